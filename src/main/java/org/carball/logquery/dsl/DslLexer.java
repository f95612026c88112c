package org.carball.logquery.dsl;

import org.carball.logquery.error.LexicalException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits DSL text into tokens. Rules are tried in priority order at each offset:
 * whitespace, quoted string, relative time, number, operator, punctuation, identifier.
 */
public class DslLexer {

    private static final String[] OPERATORS = {">=", "<=", "!=", "!~", "=", "~", ">", "<"};

    public List<Token> tokenize(String source) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = source.length();

        while (pos < length) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            if (c == '\'' || c == '"') {
                pos = readString(source, pos, tokens);
                continue;
            }

            if (c == '-' && pos + 1 < length && isDigit(source.charAt(pos + 1))) {
                pos = readNegative(source, pos, tokens);
                continue;
            }

            if (isDigit(c)) {
                pos = readNumber(source, pos, pos, tokens);
                continue;
            }

            String operator = matchOperator(source, pos);
            if (operator != null) {
                tokens.add(new Token(TokenType.OPERATOR, operator, operator, pos));
                pos += operator.length();
                continue;
            }

            if (c == '.') {
                tokens.add(new Token(TokenType.DOT, ".", ".", pos++));
                continue;
            }
            if (c == ';') {
                tokens.add(new Token(TokenType.SEMICOLON, ";", ";", pos++));
                continue;
            }

            if (isIdentifierStart(c)) {
                int start = pos;
                while (pos < length && isIdentifierPart(source.charAt(pos))) {
                    pos++;
                }
                String ident = source.substring(start, pos);
                tokens.add(new Token(TokenType.IDENTIFIER, ident, ident, start));
                continue;
            }

            throw new LexicalException("Unexpected character '" + c + "'", pos);
        }

        tokens.add(new Token(TokenType.EOF, "", "", length));
        return tokens;
    }

    private int readString(String source, int start, List<Token> tokens) throws LexicalException {
        char quote = source.charAt(start);
        StringBuilder value = new StringBuilder();
        int pos = start + 1;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                value.append(source.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == quote) {
                tokens.add(new Token(TokenType.STRING, source.substring(start, pos + 1), value.toString(), start));
                return pos + 1;
            }
            value.append(c);
            pos++;
        }
        throw new LexicalException("Unterminated string literal", start);
    }

    // "-" followed by digits: a relative time when letters follow, otherwise a negative number
    private int readNegative(String source, int start, List<Token> tokens) {
        int pos = start + 1;
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            while (pos < source.length() && Character.isLetterOrDigit(source.charAt(pos))) {
                pos++;
            }
            String text = source.substring(start, pos);
            tokens.add(new Token(TokenType.RELATIVE_TIME, text, text, start));
            return pos;
        }
        return readNumber(source, start, start + 1, tokens);
    }

    private int readNumber(String source, int start, int digitsStart, List<Token> tokens) {
        int pos = digitsStart;
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        String text = source.substring(start, pos);
        tokens.add(new Token(TokenType.NUMBER, text, text, start));
        return pos;
    }

    private String matchOperator(String source, int pos) {
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                return operator;
            }
        }
        return null;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
