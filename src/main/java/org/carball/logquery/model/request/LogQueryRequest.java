package org.carball.logquery.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.logquery.model.filter.FilterGroup;
import org.carball.logquery.model.query.SortOptions;

import java.time.Instant;
import java.util.List;

/**
 * A log search as it arrives from a client. Exactly one of {@code rawSql},
 * {@code filterGroups} or {@code query} is read, depending on {@code mode}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogQueryRequest {

    private QueryMode mode;

    @JsonProperty("raw_sql")
    private String rawSql;

    @JsonProperty("filter_groups")
    private List<FilterGroup> filterGroups;

    // LogchefQL-style DSL text
    private String query;

    @JsonProperty("start_time")
    private Instant startTime;

    @JsonProperty("end_time")
    private Instant endTime;

    // null means the configured default
    private Long limit;

    private SortOptions sort;
}
