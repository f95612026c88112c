package org.carball.logquery.dsl.ast;

public enum ValueType {
    STRING,
    NUMBER,
    RELATIVE_TIME
}
