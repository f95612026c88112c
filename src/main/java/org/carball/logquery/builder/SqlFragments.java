package org.carball.logquery.builder;

import org.carball.logquery.dsl.ast.FieldRef;
import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.error.SemanticException;
import org.carball.logquery.model.query.QueryOptions;
import org.carball.logquery.model.query.SortOptions;
import org.carball.logquery.model.query.SortOrder;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;

/**
 * SQL snippets shared by the builders. Identifiers are validated here because they are
 * the only user input ever written into SQL text; values always travel as arguments.
 */
final class SqlFragments {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    static final Pattern DOTTED_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");
    static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    static final DateTimeFormatter CLICKHOUSE_DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private SqlFragments() {
        // Utility class - prevent instantiation
    }

    static String requireTableName(QueryOptions options) throws QueryConfigException {
        if (options == null || options.getTableName() == null || options.getTableName().isBlank()) {
            throw new QueryConfigException("tableName", "table name is required");
        }
        String tableName = options.getTableName().trim();
        if (!TABLE_NAME.matcher(tableName).matches()) {
            throw new QueryConfigException("tableName", "invalid table name: " + tableName);
        }
        return tableName;
    }

    static String timestampColumn(QueryOptions options) throws QueryConfigException {
        String field = options.getTimestampField() == null ? QueryOptions.DEFAULT_TIMESTAMP_FIELD : options.getTimestampField();
        if (!IDENTIFIER.matcher(field).matches()) {
            throw new QueryConfigException("timestampField", "invalid column name: " + field);
        }
        return field;
    }

    /**
     * Renders a column expression, binding the JSON path of nested fields into {@code args}.
     */
    static String column(FieldRef field, List<Object> args) {
        if (!field.isNested()) {
            return field.name();
        }
        args.add(field.jsonPath());
        return "JSONExtractString(" + field.name() + ", ?)";
    }

    static FieldRef parseField(String field, String operator) throws SemanticException {
        if (field == null || !DOTTED_IDENTIFIER.matcher(field).matches()) {
            throw new SemanticException("Invalid field name '" + field + "' for operator " + operator);
        }
        return FieldRef.parse(field);
    }

    static void appendTimeRange(SelectStatement select, QueryOptions options) throws QueryConfigException {
        Instant start = options.getStartTime();
        Instant end = options.getEndTime();
        if (start != null && end != null && start.isAfter(end)) {
            throw new QueryConfigException("startTime", "start time cannot be after end time");
        }
        String column = timestampColumn(options);
        if (start != null) {
            select.where(column + " >= toDateTime64(?, 3)", CLICKHOUSE_DATETIME.format(start));
        }
        if (end != null) {
            select.where(column + " <= toDateTime64(?, 3)", CLICKHOUSE_DATETIME.format(end));
        }
    }

    static String orderBy(SortOptions sort) throws QueryConfigException {
        if (sort.getField() == null || !DOTTED_IDENTIFIER.matcher(sort.getField()).matches()) {
            throw new QueryConfigException("sort.field", "invalid sort field: " + sort.getField());
        }
        SortOrder order = sort.getOrder() == null ? SortOrder.ASC : sort.getOrder();
        return sort.getField() + " " + order.name();
    }

    static void applySortAndLimit(SelectStatement select, QueryOptions options, boolean defaultTimestampOrder)
            throws QueryConfigException {
        if (options.getSort() != null) {
            select.orderBy(orderBy(options.getSort()));
        } else if (defaultTimestampOrder) {
            select.orderBy(timestampColumn(options) + " DESC");
        }
        if (options.getLimit() > 0) {
            select.limit(options.getLimit());
        }
    }
}
