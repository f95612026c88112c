package org.carball.logquery.sql;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.Select;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Walks expression trees looking for nodes a read-only log query must not contain:
 * nested SELECTs, and functions or identifiers named after mutating or administrative
 * operations. String literals are never inspected, so {@code message = 'DROP'} passes.
 */
public class DisallowedNodeFinder extends ExpressionVisitorAdapter<Void> {

    public static final Set<String> DENIED_KEYWORDS = Set.of(
            "DROP", "DELETE", "TRUNCATE", "ALTER", "CREATE",
            "INSERT", "UPDATE", "RENAME", "SYSTEM", "SETTINGS");

    private String violation;

    /**
     * Returns the first violation found in {@code expression}, if any.
     */
    public Optional<String> inspect(Expression expression) {
        if (expression != null && violation == null) {
            expression.accept(this);
        }
        return Optional.ofNullable(violation);
    }

    @Override
    public <S> Void visit(Function function, S context) {
        checkName(function.getName(), "function");
        return super.visit(function, context);
    }

    @Override
    public <S> Void visit(Column column, S context) {
        checkName(column.getColumnName(), "identifier");
        Table table = column.getTable();
        if (table != null && table.getFullyQualifiedName() != null) {
            checkName(table.getFullyQualifiedName(), "identifier");
        }
        return super.visit(column, context);
    }

    @Override
    public <S> Void visit(ParenthesedSelect select, S context) {
        record("subqueries are not allowed");
        return null;
    }

    // Nested selects in expression position dispatch here, not to the ParenthesedSelect overload
    @Override
    public <S> Void visit(Select select, S context) {
        record("subqueries are not allowed");
        return null;
    }

    private void checkName(String name, String kind) {
        if (name == null) {
            return;
        }
        for (String part : name.split("\\.")) {
            String normalized = part.replace("`", "").replace("\"", "").toUpperCase(Locale.ROOT);
            if (DENIED_KEYWORDS.contains(normalized)) {
                record("dangerous operation detected: " + kind + " " + name);
                return;
            }
        }
    }

    private void record(String message) {
        if (violation == null) {
            violation = message;
        }
    }
}
