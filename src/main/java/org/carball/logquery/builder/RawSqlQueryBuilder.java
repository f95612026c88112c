package org.carball.logquery.builder;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.OracleHierarchicalExpression;
import net.sf.jsqlparser.expression.WindowDefinition;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.select.Distinct;
import net.sf.jsqlparser.statement.select.Fetch;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.Top;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.error.QuerySecurityException;
import org.carball.logquery.error.QuerySyntaxException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;
import org.carball.logquery.sql.DisallowedNodeFinder;
import org.carball.logquery.sql.TableReference;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates user-written SQL and re-serializes it. The statement must be a single plain
 * SELECT over {@link QueryOptions#getTableName()} with no joins, subqueries or
 * mutating functions. A LIMIT is injected when the query has none.
 * <p>
 * The output carries no arguments: literals stay inline as written.
 */
@Slf4j
public class RawSqlQueryBuilder implements QueryBuilder {

    private final String sql;
    private final QueryOptions options;

    public RawSqlQueryBuilder(String sql, QueryOptions options) {
        this.sql = sql;
        this.options = options;
    }

    @Override
    public Query build() throws QueryBuildException {
        TableReference allowedTable = TableReference.parse(SqlFragments.requireTableName(options));
        PlainSelect select = parseSingleSelect();

        validateFrom(select, allowedTable);
        validateExpressions(select);
        validateReferencedTables(select, allowedTable);

        if (select.getLimit() == null && select.getFetch() == null && options.getLimit() > 0) {
            select.setLimit(new Limit().withRowCount(new LongValue(options.getLimit())));
            log.debug("Injected LIMIT {} into raw SQL", options.getLimit());
        }

        Query query = Query.of(select.toString());
        log.debug("Validated raw SQL: {}", query.sql());
        return query;
    }

    private PlainSelect parseSingleSelect() throws QueryBuildException {
        if (sql == null || sql.isBlank()) {
            throw new QuerySyntaxException("Empty SQL query", 0);
        }

        Statements statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(sql);
        } catch (JSQLParserException e) {
            String detail = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            throw new QuerySyntaxException("Invalid SQL syntax: " + detail, e);
        }

        List<Statement> parsed = statements.getStatements();
        if (parsed == null || parsed.isEmpty()) {
            throw new QuerySyntaxException("Empty SQL query", 0);
        }
        if (parsed.size() > 1) {
            throw reject("only a single statement is allowed, found " + parsed.size());
        }

        Statement statement = parsed.get(0);
        if (!(statement instanceof Select selectStatement)) {
            throw reject("only SELECT queries are allowed");
        }
        if (selectStatement.getWithItemsList() != null && !selectStatement.getWithItemsList().isEmpty()) {
            throw reject("WITH clauses are not allowed");
        }
        if (!(selectStatement instanceof PlainSelect plainSelect)) {
            throw reject("only simple SELECT queries are allowed; set operations and parenthesized queries are rejected");
        }
        if (plainSelect.getIntoTables() != null && !plainSelect.getIntoTables().isEmpty()) {
            throw reject("SELECT INTO is not allowed");
        }
        if (plainSelect.getForMode() != null || plainSelect.getForUpdateTable() != null) {
            throw reject("locking clauses such as FOR UPDATE are not allowed");
        }
        return plainSelect;
    }

    private void validateFrom(PlainSelect select, TableReference allowedTable) throws QuerySecurityException {
        FromItem fromItem = select.getFromItem();
        if (fromItem == null) {
            throw reject("query must select from " + allowedTable);
        }
        if (select.getJoins() != null && !select.getJoins().isEmpty()) {
            throw reject("joins are not allowed");
        }
        if (fromItem instanceof ParenthesedSelect) {
            throw reject("subqueries are not allowed");
        }
        if (!(fromItem instanceof Table table)) {
            throw reject("unsupported table source: " + fromItem);
        }

        TableReference referenced = TableReference.of(table);
        if (!referenced.resolvesTo(allowedTable)) {
            throw reject("invalid table reference: " + referenced + ", expected: " + allowedTable);
        }
    }

    private void validateExpressions(PlainSelect select) throws QuerySecurityException {
        DisallowedNodeFinder finder = new DisallowedNodeFinder();

        Distinct distinct = select.getDistinct();
        if (distinct != null && distinct.getOnSelectItems() != null) {
            checkItems(finder, distinct.getOnSelectItems());
        }
        Top top = select.getTop();
        if (top != null) {
            check(finder, top.getExpression());
        }
        if (select.getSelectItems() != null) {
            checkItems(finder, select.getSelectItems());
        }
        check(finder, select.getWhere());
        OracleHierarchicalExpression hierarchical = select.getOracleHierarchical();
        if (hierarchical != null) {
            check(finder, hierarchical.getStartExpression());
            check(finder, hierarchical.getConnectExpression());
        }
        if (select.getGroupBy() != null) {
            check(finder, select.getGroupBy().getGroupByExpressionList());
        }
        check(finder, select.getHaving());
        check(finder, select.getQualify());
        if (select.getWindowDefinitions() != null) {
            for (WindowDefinition window : select.getWindowDefinitions()) {
                check(finder, window.getPartitionExpressionList());
                checkOrderBy(finder, window.getOrderByElements());
            }
        }
        checkOrderBy(finder, select.getOrderByElements());
        checkLimit(finder, select.getLimitBy());
        checkLimit(finder, select.getLimit());

        Offset offset = select.getOffset();
        if (offset != null) {
            check(finder, offset.getOffset());
        }
        Fetch fetch = select.getFetch();
        if (fetch != null) {
            check(finder, fetch.getExpression());
        }
    }

    private void checkItems(DisallowedNodeFinder finder, List<SelectItem<?>> items) throws QuerySecurityException {
        for (SelectItem<?> item : items) {
            check(finder, item.getExpression());
        }
    }

    private void checkOrderBy(DisallowedNodeFinder finder, List<OrderByElement> elements) throws QuerySecurityException {
        if (elements == null) {
            return;
        }
        for (OrderByElement element : elements) {
            check(finder, element.getExpression());
        }
    }

    private void checkLimit(DisallowedNodeFinder finder, Limit limit) throws QuerySecurityException {
        if (limit == null) {
            return;
        }
        check(finder, limit.getRowCount());
        check(finder, limit.getOffset());
        check(finder, limit.getByExpressions());
    }

    /**
     * Every table JSqlParser can find anywhere in the statement must be the allowed one.
     */
    private void validateReferencedTables(PlainSelect select, TableReference allowedTable) throws QuerySecurityException {
        Set<String> tables;
        try {
            tables = new TablesNamesFinder<Void>().getTables((Statement) select);
        } catch (UnsupportedOperationException e) {
            log.debug("Table scan not supported for raw SQL: {}", e.getMessage());
            throw reject("unsupported SQL construct: " + e.getMessage());
        }

        for (String name : tables) {
            TableReference referenced = TableReference.parse(name);
            if (!referenced.resolvesTo(allowedTable)) {
                throw reject("invalid table reference: " + referenced + ", expected: " + allowedTable);
            }
        }
    }

    private void check(DisallowedNodeFinder finder, Expression expression) throws QuerySecurityException {
        Optional<String> violation = finder.inspect(expression);
        if (violation.isPresent()) {
            throw reject(violation.get());
        }
    }

    private QuerySecurityException reject(String reason) {
        log.warn("Rejected raw SQL for table {}: {}", options.getTableName(), reason);
        return new QuerySecurityException(reason);
    }
}
