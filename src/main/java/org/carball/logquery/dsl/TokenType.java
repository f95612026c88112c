package org.carball.logquery.dsl;

public enum TokenType {
    STRING,
    RELATIVE_TIME,
    NUMBER,
    OPERATOR,
    DOT,
    SEMICOLON,
    IDENTIFIER,
    EOF
}
