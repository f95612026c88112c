package org.carball.logquery.error;

import lombok.Getter;

/**
 * Grammar violation in DSL text or unparseable raw SQL.
 */
@Getter
public class QuerySyntaxException extends QueryBuildException {

    public static final int UNKNOWN_POSITION = -1;

    private final int position;

    public QuerySyntaxException(String message, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.position = position;
    }

    public QuerySyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.position = UNKNOWN_POSITION;
    }
}
