package org.carball.logquery.dsl.ast;

public record DslFilter(FieldRef field, ComparisonOperator operator, DslValue value, int position) {
}
