package org.carball.logquery.model.result;

public record ColumnInfo(String name, String type) {
}
