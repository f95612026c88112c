package org.carball.logquery.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum SortOrder {
    ASC,
    DESC;

    @JsonCreator
    public static SortOrder fromString(String value) {
        for (SortOrder order : values()) {
            if (order.name().equalsIgnoreCase(value)) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unknown sort order: " + value + ". Use ASC or DESC");
    }
}
