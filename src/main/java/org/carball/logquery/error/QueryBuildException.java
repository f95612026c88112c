package org.carball.logquery.error;

/**
 * Base type for every failure a query builder can report. A builder either returns a
 * complete query or throws one of the subclasses; it never returns partial SQL.
 */
public class QueryBuildException extends Exception {

    public QueryBuildException(String message) {
        super(message);
    }

    public QueryBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
