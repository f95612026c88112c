package org.carball.logquery.builder;

import org.carball.logquery.dsl.DslParser;
import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.model.filter.FilterGroup;
import org.carball.logquery.model.query.QueryOptions;
import org.carball.logquery.model.request.LogQueryRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the user asked for, in one of the three supported input modes. Each mode knows
 * which builder compiles it, so callers never branch on the mode themselves.
 */
public sealed interface QuerySpec permits QuerySpec.RawSql, QuerySpec.Filters, QuerySpec.Dsl {

    QueryBuilder toBuilder(DslParser dslParser, QueryOptions options);

    /**
     * Picks the input that matches the request's mode; the other inputs are ignored.
     */
    static QuerySpec from(LogQueryRequest request) throws QueryConfigException {
        if (request.getMode() == null) {
            throw new QueryConfigException("mode", "query mode is required");
        }
        return switch (request.getMode()) {
            case SQL -> rawSql(request.getRawSql());
            case FILTERS -> filters(request.getFilterGroups());
            case DSL -> dsl(request.getQuery());
        };
    }

    static QuerySpec rawSql(String sql) {
        return new RawSql(sql);
    }

    static QuerySpec filters(List<FilterGroup> groups) {
        return new Filters(groups);
    }

    static QuerySpec dsl(String query) {
        return new Dsl(query);
    }

    record RawSql(String sql) implements QuerySpec {
        @Override
        public QueryBuilder toBuilder(DslParser dslParser, QueryOptions options) {
            return new RawSqlQueryBuilder(sql, options);
        }
    }

    record Filters(List<FilterGroup> groups) implements QuerySpec {
        public Filters {
            groups = groups == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(groups));
        }

        @Override
        public QueryBuilder toBuilder(DslParser dslParser, QueryOptions options) {
            return new FilterQueryBuilder(groups, options);
        }
    }

    record Dsl(String query) implements QuerySpec {
        @Override
        public QueryBuilder toBuilder(DslParser dslParser, QueryOptions options) {
            return new DslQueryBuilder(dslParser, query, options);
        }
    }
}
