package org.carball.logquery.model.filter;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum GroupOperator {
    AND,
    OR;

    public String sqlKeyword() {
        return " " + name() + " ";
    }

    @JsonCreator
    public static GroupOperator fromString(String value) {
        if (value == null || value.isBlank()) {
            return AND;
        }
        return GroupOperator.valueOf(value.trim().toUpperCase());
    }
}
