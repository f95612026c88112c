package org.carball.logquery.error;

/**
 * Raw SQL that parses but is not allowed to run: anything other than a single SELECT
 * over the configured table.
 */
public class QuerySecurityException extends QueryBuildException {

    public QuerySecurityException(String message) {
        super(message);
    }
}
