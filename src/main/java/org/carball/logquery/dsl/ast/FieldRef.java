package org.carball.logquery.dsl.ast;

import java.util.List;

/**
 * Field reference such as {@code service_name}, {@code p.error.code} or
 * {@code attributes.user.id}. Sub-segments address a key inside the JSON/map column
 * named by {@code name}; the reserved base {@code p} contributes nothing to the path.
 */
public record FieldRef(String name, List<String> subFields, int position) {

    public static final String JSON_PAYLOAD_COLUMN = "p";

    public FieldRef {
        subFields = List.copyOf(subFields);
    }

    public static FieldRef simple(String name) {
        return new FieldRef(name, List.of(), 0);
    }

    public boolean isNested() {
        return !subFields.isEmpty();
    }

    /**
     * Dotted key path below the base column.
     */
    public String jsonPath() {
        return String.join(".", subFields);
    }

    public String fullPath() {
        if (!isNested()) {
            return name;
        }
        return JSON_PAYLOAD_COLUMN.equals(name) ? jsonPath() : name + "." + jsonPath();
    }

    /**
     * Splits {@code a.b.c} into base {@code a} and path {@code b.c}.
     */
    public static FieldRef parse(String dotted) {
        String[] parts = dotted.split("\\.", -1);
        return new FieldRef(parts[0], List.of(parts).subList(1, parts.length), 0);
    }
}
