package org.carball.logquery.dsl.ast;

/**
 * Literal on the right-hand side of a filter. {@code text} is already unquoted.
 */
public record DslValue(ValueType type, String text) {

    public boolean isRelativeTime() {
        return type == ValueType.RELATIVE_TIME;
    }
}
