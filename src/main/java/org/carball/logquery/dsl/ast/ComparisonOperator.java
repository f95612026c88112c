package org.carball.logquery.dsl.ast;

import java.util.Optional;

public enum ComparisonOperator {
    EQUALS("="),
    NOT_EQUALS("!="),
    MATCHES("~"),
    NOT_MATCHES("!~"),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_EQUALS(">="),
    LESS_EQUALS("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isPattern() {
        return this == MATCHES || this == NOT_MATCHES;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
