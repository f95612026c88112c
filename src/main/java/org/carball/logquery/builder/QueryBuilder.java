package org.carball.logquery.builder;

import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.model.query.Query;

/**
 * Turns one query input into an executable statement. Implementations are
 * pure: the same input always yields the same {@link Query}, nothing is cached and no
 * I/O happens, so a builder can be shared across threads.
 */
public interface QueryBuilder {

    Query build() throws QueryBuildException;
}
