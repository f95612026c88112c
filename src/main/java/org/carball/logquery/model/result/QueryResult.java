package org.carball.logquery.model.result;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by a {@link org.carball.logquery.service.QueryExecutor}, keyed by column
 * name, with the column metadata in result order.
 */
public record QueryResult(List<Map<String, Object>> rows, List<ColumnInfo> columns, QueryStats stats) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        columns = columns == null ? List.of() : List.copyOf(columns);
        stats = stats == null ? QueryStats.empty() : stats;
    }

    public int rowCount() {
        return rows.size();
    }
}
