package org.carball.logquery.dsl;

/**
 * @param text     source text as written, quotes included
 * @param value    decoded value; for strings the unquoted, unescaped content
 * @param position 0-based offset of the first character
 */
public record Token(TokenType type, String text, String value, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public String describe() {
        return type == TokenType.EOF ? "end of input" : type + " '" + text + "'";
    }
}
