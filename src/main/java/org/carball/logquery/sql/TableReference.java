package org.carball.logquery.sql;

import net.sf.jsqlparser.schema.Table;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A table name with an optional database qualifier, compared without identifier quotes.
 */
public record TableReference(String database, String table) {

    public static TableReference parse(String reference) {
        List<String> parts = splitUnquoted(reference);
        if (parts.size() == 1) {
            return new TableReference(null, parts.get(0));
        }
        if (parts.size() == 2) {
            return new TableReference(parts.get(0), parts.get(1));
        }
        // Three or more parts never match an allowed reference
        return new TableReference(String.join(".", parts.subList(0, parts.size() - 1)), parts.get(parts.size() - 1));
    }

    public static TableReference of(Table table) {
        return parse(table.getFullyQualifiedName());
    }

    public boolean isQualified() {
        return database != null;
    }

    /**
     * True when this reference, taken from a query, resolves to {@code allowed}. An
     * unqualified reference only has to match the table part.
     */
    public boolean resolvesTo(TableReference allowed) {
        if (!table.equals(allowed.table)) {
            return false;
        }
        if (!isQualified()) {
            return true;
        }
        return database.equals(allowed.database);
    }

    @Override
    public String toString() {
        return isQualified() ? database + "." + table : table;
    }

    private static List<String> splitUnquoted(String reference) {
        return Arrays.stream(reference.trim().split("\\."))
                .map(TableReference::unquote)
                .collect(Collectors.toList());
    }

    private static String unquote(String identifier) {
        String trimmed = identifier.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '`' && last == '`') || (first == '"' && last == '"')) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }
}
