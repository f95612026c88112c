package org.carball.logquery.error;

import lombok.Getter;

/**
 * Missing or invalid builder configuration (table name, limit, time range, sort).
 */
@Getter
public class QueryConfigException extends QueryBuildException {

    private final String field;

    public QueryConfigException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }
}
