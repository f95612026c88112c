package org.carball.logquery.builder;

import org.carball.logquery.model.query.Query;

/**
 * Queries for the rows surrounding one log line. {@code before} or {@code after} is
 * null when its limit was zero.
 */
public record LogContextQueries(Query before, Query target, Query after) {

    public boolean hasBefore() {
        return before != null;
    }

    public boolean hasAfter() {
        return after != null;
    }
}
