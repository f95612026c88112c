package org.carball.logquery.service;

import org.carball.logquery.error.QueryExecutionException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.result.QueryResult;

/**
 * Runs a compiled query against the log store. Implementations own connections and
 * timeouts; the compiler never talks to the database itself.
 */
public interface QueryExecutor {

    QueryResult execute(Query query, String tableName) throws QueryExecutionException;
}
