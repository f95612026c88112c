package org.carball.logquery.dsl.ast;

import java.util.List;

/**
 * Root of a parsed DSL query. Filters are implicitly AND-ed in source order.
 */
public record DslQuery(List<DslFilter> filters) {

    public DslQuery {
        filters = List.copyOf(filters);
    }

    public int size() {
        return filters.size();
    }
}
