package org.carball.logquery.builder;

import org.carball.logquery.model.query.Query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Accumulates one SELECT while a builder runs. Predicates are AND-ed in the order they
 * were added; each predicate's placeholders must match the arguments added with it.
 */
final class SelectStatement {

    private final String projection;
    private final String table;
    private final List<String> predicates = new ArrayList<>();
    private final List<Object> args = new ArrayList<>();
    private String groupBy;
    private String orderBy;
    private long limit;

    SelectStatement(String projection, String table) {
        this.projection = projection;
        this.table = table;
    }

    static SelectStatement selectAll(String table) {
        return new SelectStatement("*", table);
    }

    SelectStatement where(String predicate, Object... bound) {
        predicates.add(predicate);
        args.addAll(Arrays.asList(bound));
        return this;
    }

    SelectStatement where(String predicate, List<Object> bound) {
        predicates.add(predicate);
        args.addAll(bound);
        return this;
    }

    SelectStatement groupBy(String groupBy) {
        this.groupBy = groupBy;
        return this;
    }

    SelectStatement orderBy(String orderBy) {
        this.orderBy = orderBy;
        return this;
    }

    SelectStatement limit(long limit) {
        this.limit = limit;
        return this;
    }

    int predicateCount() {
        return predicates.size();
    }

    Query toQuery() {
        StringBuilder sql = new StringBuilder("SELECT ").append(projection).append(" FROM ").append(table);
        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
        if (groupBy != null) {
            sql.append(" GROUP BY ").append(groupBy);
        }
        if (orderBy != null) {
            sql.append(" ORDER BY ").append(orderBy);
        }
        if (limit > 0) {
            sql.append(" LIMIT ").append(limit);
        }
        return new Query(sql.toString(), args);
    }
}
