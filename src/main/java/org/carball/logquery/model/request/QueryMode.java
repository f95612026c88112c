package org.carball.logquery.model.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryMode {
    SQL("sql"),
    FILTERS("filters"),
    DSL("dsl");

    private final String value;

    QueryMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static QueryMode fromValue(String value) {
        for (QueryMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown query mode: " + value + ". Use sql, filters or dsl");
    }
}
