package org.carball.logquery.model.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled SELECT statement and its positional arguments, in placeholder order.
 * Raw SQL compiles to a statement with no arguments.
 */
public record Query(String sql, List<Object> args) {

    public Query {
        // Arguments may contain nulls
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static Query of(String sql) {
        return new Query(sql, List.of());
    }

    public int argumentCount() {
        return args.size();
    }
}
