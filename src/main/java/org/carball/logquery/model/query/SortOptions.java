package org.carball.logquery.model.query;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SortOptions {
    private String field;
    private SortOrder order;

    public static SortOptions descending(String field) {
        return new SortOptions(field, SortOrder.DESC);
    }

    public static SortOptions ascending(String field) {
        return new SortOptions(field, SortOrder.ASC);
    }
}
