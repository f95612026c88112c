package org.carball.logquery.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.model.query.Query;

import java.time.Instant;
import java.util.List;

/**
 * JSON rendering of a compiled query, as printed by the command line tool.
 */
@Slf4j
public class CompiledQueryReport {

    private final String mode;
    private final String table;
    private final Query query;
    private final Instant generatedAt;
    private final ObjectMapper objectMapper;

    public CompiledQueryReport(String mode, String table, Query query) {
        this(mode, table, query, Instant.now());
    }

    public CompiledQueryReport(String mode, String table, Query query, Instant generatedAt) {
        this.mode = mode;
        this.table = table;
        this.query = query;
        this.generatedAt = generatedAt;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(
                    new ReportData(mode, table, query.sql(), query.args(), query.argumentCount(), generatedAt));
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public record ReportData(
            String mode,
            String table,
            String sql,
            List<Object> args,
            @JsonProperty("argument_count") int argumentCount,
            @JsonProperty("generated_at") Instant generatedAt) {
    }
}
