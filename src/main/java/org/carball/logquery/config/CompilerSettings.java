package org.carball.logquery.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.model.query.QueryOptions;

@Data
@Slf4j
public class CompilerSettings {

    public static final long DEFAULT_LIMIT = 100;
    public static final long MAX_LIMIT = 100_000;

    // Applied when a request does not set a limit
    @JsonProperty("default_limit")
    private long defaultLimit = DEFAULT_LIMIT;

    @JsonProperty("max_limit")
    private long maxLimit = MAX_LIMIT;

    @JsonProperty("timestamp_field")
    private String timestampField = QueryOptions.DEFAULT_TIMESTAMP_FIELD;

    @JsonProperty("default_table")
    private String defaultTable;

    public static CompilerSettings defaults() {
        return new CompilerSettings();
    }

    /**
     * Logs a warning for every value that will make queries fail or behave oddly.
     */
    public void validate() {
        if (maxLimit <= 0) {
            log.warn("Max limit ({}) should be positive", maxLimit);
        }

        if (defaultLimit <= 0) {
            log.warn("Default limit ({}) should be positive", defaultLimit);
        }

        if (defaultLimit > maxLimit) {
            log.warn("Default limit ({}) should not exceed max limit ({})", defaultLimit, maxLimit);
        }

        if (timestampField == null || timestampField.isBlank()) {
            log.warn("Timestamp field is empty; time range filters will be rejected");
        }

        log.debug("Using settings - default limit: {}, max limit: {}, timestamp field: {}, table: {}",
                defaultLimit, maxLimit, timestampField, defaultTable);
    }

    public String getSummary() {
        return String.format("default_limit=%d, max_limit=%d, timestamp_field=%s, default_table=%s",
                defaultLimit, maxLimit, timestampField, defaultTable);
    }
}
