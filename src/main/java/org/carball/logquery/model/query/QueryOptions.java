package org.carball.logquery.model.query;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Settings shared by every builder. {@code tableName} is also the only table raw SQL
 * may reference.
 */
@Value
@Builder(toBuilder = true)
public class QueryOptions {

    public static final String DEFAULT_TIMESTAMP_FIELD = "timestamp";

    String tableName;

    Instant startTime;

    Instant endTime;

    long limit;

    SortOptions sort;

    @Builder.Default
    String timestampField = DEFAULT_TIMESTAMP_FIELD;

    public static QueryOptions forTable(String tableName) {
        return QueryOptions.builder().tableName(tableName).build();
    }

    public boolean hasTimeRange() {
        return startTime != null || endTime != null;
    }
}
