package org.carball.logquery.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.dsl.DslParser;
import org.carball.logquery.dsl.RelativeTime;
import org.carball.logquery.dsl.ast.ComparisonOperator;
import org.carball.logquery.dsl.ast.DslFilter;
import org.carball.logquery.dsl.ast.DslQuery;
import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.error.SemanticException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles DSL text such as {@code service_name='api';p.error.code=500;timestamp>-1h}
 * into a parameterized SELECT. Filters are AND-ed in source order; a failure in any
 * filter fails the whole build.
 */
@Slf4j
public class DslQueryBuilder implements QueryBuilder {

    private final DslParser parser;
    private final String queryText;
    private final QueryOptions options;

    public DslQueryBuilder(DslParser parser, String queryText, QueryOptions options) {
        this.parser = parser;
        this.queryText = queryText;
        this.options = options;
    }

    @Override
    public Query build() throws QueryBuildException {
        String table = SqlFragments.requireTableName(options);
        DslQuery ast = parser.parse(queryText);

        SelectStatement select = SelectStatement.selectAll(table);
        SqlFragments.appendTimeRange(select, options);
        appendFilters(select, ast);
        SqlFragments.applySortAndLimit(select, options, false);

        Query query = select.toQuery();
        log.debug("Compiled {} DSL filter(s) into: {} ({} args)", ast.size(), query.sql(), query.argumentCount());
        return query;
    }

    static void appendFilters(SelectStatement select, DslQuery ast) throws SemanticException {
        for (DslFilter filter : ast.filters()) {
            List<Object> args = new ArrayList<>();
            String predicate = compileFilter(filter, args);
            select.where(predicate, args);
        }
    }

    static String compileFilter(DslFilter filter, List<Object> args) throws SemanticException {
        String column = SqlFragments.column(filter.field(), args);
        ComparisonOperator operator = filter.operator();
        String value = filter.value().text();

        if (operator.isPattern()) {
            args.add("%" + value + "%");
            return column + (operator == ComparisonOperator.MATCHES ? " ILIKE ?" : " NOT ILIKE ?");
        }

        if (filter.value().isRelativeTime()) {
            RelativeTime interval = RelativeTime.parse(value);
            args.add(interval.literal());
            return column + " " + operator.getSymbol() + " now() - INTERVAL ?";
        }

        args.add(value);
        return column + " " + operator.getSymbol() + " ?";
    }
}
