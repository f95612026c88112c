package org.carball.logquery.service;

import org.carball.logquery.config.CompilerSettings;
import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.model.filter.FilterGroup;
import org.carball.logquery.model.request.LogQueryRequest;

import java.time.Instant;
import java.util.List;

/**
 * Checks a {@link LogQueryRequest} before compilation. Builders repeat some of these
 * checks; doing them here gives clients field-level messages up front.
 */
public class QueryRequestValidator {

    private final CompilerSettings settings;

    public QueryRequestValidator(CompilerSettings settings) {
        this.settings = settings;
    }

    public void validate(LogQueryRequest request) throws QueryConfigException {
        if (request == null) {
            throw new QueryConfigException("request", "request is required");
        }
        if (request.getMode() == null) {
            throw new QueryConfigException("mode", "query mode is required");
        }

        validateInput(request);
        validateTimeRange(request);
        validateLimit(request.getLimit());

        if (request.getSort() != null) {
            if (request.getSort().getField() == null || request.getSort().getField().isBlank()) {
                throw new QueryConfigException("sort.field", "sort field is required");
            }
            if (request.getSort().getOrder() == null) {
                throw new QueryConfigException("sort.order", "sort order must be ASC or DESC");
            }
        }
    }

    private void validateInput(LogQueryRequest request) throws QueryConfigException {
        switch (request.getMode()) {
            case SQL -> {
                if (isBlank(request.getRawSql())) {
                    throw new QueryConfigException("raw_sql", "raw SQL is required in sql mode");
                }
            }
            case DSL -> {
                if (isBlank(request.getQuery())) {
                    throw new QueryConfigException("query", "query text is required in dsl mode");
                }
            }
            case FILTERS -> {
                List<FilterGroup> groups = request.getFilterGroups();
                if (groups == null) {
                    throw new QueryConfigException("filter_groups", "filter groups are required in filters mode");
                }
            }
        }
    }

    private void validateTimeRange(LogQueryRequest request) throws QueryConfigException {
        if (request.getStartTime() == null) {
            throw new QueryConfigException("start_time", "start time is required");
        }
        if (request.getEndTime() == null) {
            throw new QueryConfigException("end_time", "end time is required");
        }
        if (!request.getStartTime().isAfter(Instant.EPOCH)) {
            throw new QueryConfigException("start_time", "start time must be greater than 0");
        }
        if (request.getStartTime().isAfter(request.getEndTime())) {
            throw new QueryConfigException("start_time", "start time must be before end time");
        }
    }

    private void validateLimit(Long limit) throws QueryConfigException {
        if (limit == null) {
            return;
        }
        if (limit <= 0) {
            throw new QueryConfigException("limit", "limit must be greater than 0");
        }
        if (limit > settings.getMaxLimit()) {
            throw new QueryConfigException("limit", "limit cannot be greater than " + settings.getMaxLimit());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
