package org.carball.logquery.service;

import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.builder.HistogramInterval;
import org.carball.logquery.builder.LogContextQueries;
import org.carball.logquery.builder.QueryCompiler;
import org.carball.logquery.builder.QuerySpec;
import org.carball.logquery.config.CompilerSettings;
import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.error.QueryExecutionException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;
import org.carball.logquery.model.request.LogContextRequest;
import org.carball.logquery.model.request.LogQueryRequest;
import org.carball.logquery.model.request.QueryMode;
import org.carball.logquery.model.result.QueryResult;

/**
 * Validates client requests, compiles them and hands the result to a {@link QueryExecutor}.
 */
@Slf4j
public class LogQueryService {

    private final QueryCompiler compiler;
    private final QueryRequestValidator validator;
    private final QueryExecutor executor;
    private final CompilerSettings settings;

    public LogQueryService(QueryCompiler compiler, QueryExecutor executor, CompilerSettings settings) {
        this.compiler = compiler;
        this.validator = new QueryRequestValidator(settings);
        this.executor = executor;
        this.settings = settings;
    }

    public Query compile(String tableName, LogQueryRequest request) throws QueryBuildException {
        validator.validate(request);
        QueryOptions options = toOptions(tableName, request);

        Query query = compiler.compile(QuerySpec.from(request), options);
        log.debug("Compiled {} request for {} with {} arguments", request.getMode(), options.getTableName(),
                query.argumentCount());
        return query;
    }

    public QueryResult query(String tableName, LogQueryRequest request)
            throws QueryBuildException, QueryExecutionException {
        Query query = compile(tableName, request);
        QueryResult result = executor.execute(query, tableName(tableName));
        log.debug("Query returned {} rows", result.rowCount());
        return result;
    }

    /**
     * Compiles a histogram over the request's time range. In dsl mode the query text
     * filters the counted rows; other modes count everything in range.
     */
    public Query histogram(String tableName, LogQueryRequest request, HistogramInterval interval)
            throws QueryBuildException {
        validator.validate(request);
        String dslFilter = request.getMode() == QueryMode.DSL
                ? request.getQuery()
                : null;
        return compiler.histogram(toOptions(tableName, request), interval, dslFilter).build();
    }

    public LogContextQueries context(String tableName, LogContextRequest request) throws QueryBuildException {
        QueryOptions options = QueryOptions.builder()
                .tableName(tableName(tableName))
                .timestampField(settings.getTimestampField())
                .build();
        return compiler.context(options, request.getTimestamp(), request.getBeforeLimit(), request.getAfterLimit())
                .build();
    }

    QueryOptions toOptions(String tableName, LogQueryRequest request) throws QueryConfigException {
        long limit = request.getLimit() != null ? request.getLimit() : settings.getDefaultLimit();
        return QueryOptions.builder()
                .tableName(tableName(tableName))
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .limit(limit)
                .sort(request.getSort())
                .timestampField(settings.getTimestampField())
                .build();
    }

    private String tableName(String tableName) throws QueryConfigException {
        if (tableName != null && !tableName.isBlank()) {
            return tableName;
        }
        if (settings.getDefaultTable() != null && !settings.getDefaultTable().isBlank()) {
            return settings.getDefaultTable();
        }
        throw new QueryConfigException("tableName", "table name is required");
    }
}
