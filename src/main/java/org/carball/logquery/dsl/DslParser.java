package org.carball.logquery.dsl;

import org.carball.logquery.dsl.ast.ComparisonOperator;
import org.carball.logquery.dsl.ast.DslFilter;
import org.carball.logquery.dsl.ast.DslQuery;
import org.carball.logquery.dsl.ast.DslValue;
import org.carball.logquery.dsl.ast.FieldRef;
import org.carball.logquery.dsl.ast.ValueType;
import org.carball.logquery.error.LexicalException;
import org.carball.logquery.error.QuerySyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the filter DSL:
 * <pre>
 * Query  := Filter (';' Filter)*
 * Filter := Field Operator Value
 * Field  := Ident ('.' Ident)*
 * Value  := String | Number | RelativeTime
 * </pre>
 * Instances hold no per-parse state and can be shared between threads.
 */
public class DslParser {

    private final DslLexer lexer;

    public DslParser() {
        this(new DslLexer());
    }

    public DslParser(DslLexer lexer) {
        this.lexer = lexer;
    }

    public DslQuery parse(String source) throws LexicalException, QuerySyntaxException {
        if (source == null || source.isBlank()) {
            throw new QuerySyntaxException("Empty query", 0);
        }
        return new Cursor(lexer.tokenize(source)).query();
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        DslQuery query() throws QuerySyntaxException {
            List<DslFilter> filters = new ArrayList<>();
            filters.add(filter());
            while (peek().is(TokenType.SEMICOLON)) {
                advance();
                filters.add(filter());
            }
            Token trailing = peek();
            if (!trailing.is(TokenType.EOF)) {
                throw unexpected(trailing, "';' or end of input");
            }
            return new DslQuery(filters);
        }

        private DslFilter filter() throws QuerySyntaxException {
            FieldRef field = field();
            ComparisonOperator operator = operator();
            DslValue value = value();
            return new DslFilter(field, operator, value, field.position());
        }

        private FieldRef field() throws QuerySyntaxException {
            Token base = peek();
            if (!base.is(TokenType.IDENTIFIER)) {
                throw unexpected(base, "field name starting with a letter or underscore");
            }
            advance();

            List<String> subFields = new ArrayList<>();
            while (peek().is(TokenType.DOT)) {
                Token dot = advance();
                Token segment = peek();
                if (!segment.is(TokenType.IDENTIFIER)) {
                    throw new QuerySyntaxException(
                            "Empty or invalid field segment after '.' in field '" + base.text() + "'", dot.position());
                }
                subFields.add(advance().text());
            }
            return new FieldRef(base.text(), subFields, base.position());
        }

        private ComparisonOperator operator() throws QuerySyntaxException {
            Token token = peek();
            if (!token.is(TokenType.OPERATOR)) {
                throw unexpected(token, "operator (= != ~ !~ > < >= <=)");
            }
            advance();
            return ComparisonOperator.fromSymbol(token.text())
                    .orElseThrow(() -> new QuerySyntaxException("Unknown operator '" + token.text() + "'", token.position()));
        }

        private DslValue value() throws QuerySyntaxException {
            Token token = peek();
            ValueType type = switch (token.type()) {
                case STRING -> ValueType.STRING;
                case NUMBER -> ValueType.NUMBER;
                case RELATIVE_TIME -> ValueType.RELATIVE_TIME;
                default -> throw unexpected(token, "value (quoted string, number or relative time)");
            };
            advance();
            return new DslValue(type, token.value());
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        private static QuerySyntaxException unexpected(Token token, String expected) {
            return new QuerySyntaxException("Unexpected token " + token.describe() + ", expected " + expected,
                    token.position());
        }
    }
}
