package org.carball.logquery.error;

/**
 * Raised by a query executor when a compiled query fails against the database.
 */
public class QueryExecutionException extends Exception {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
