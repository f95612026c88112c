package org.carball.logquery.error;

import lombok.Getter;

/**
 * Raised by the DSL lexer for a character that starts no token.
 */
@Getter
public class LexicalException extends QueryBuildException {

    private final int position;

    public LexicalException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }
}
