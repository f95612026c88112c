package org.carball.logquery.model.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operators available to structured filters. The wire names match what the UI sends.
 */
public enum FilterOperator {
    EQUALS("="),
    NOT_EQUALS("!="),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    ICONTAINS("icontains"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith"),
    GREATER_THAN(">"),
    GREATER_EQUALS(">="),
    LESS_THAN("<"),
    LESS_EQUALS("<="),
    IN("in"),
    NOT_IN("not_in"),
    IS_NULL("is_null"),
    IS_NOT_NULL("is_not_null");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public boolean takesValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    public boolean takesList() {
        return this == IN || this == NOT_IN;
    }

    @JsonCreator
    public static FilterOperator fromSymbol(String symbol) {
        for (FilterOperator operator : values()) {
            if (operator.symbol.equalsIgnoreCase(symbol) || operator.name().equalsIgnoreCase(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
