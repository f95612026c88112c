package org.carball.logquery.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.dsl.DslParser;
import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;

/**
 * Entry point for compiling any {@link QuerySpec}. Create one per process and share it;
 * it owns the DSL parser and keeps no other state.
 */
@Slf4j
public class QueryCompiler {

    private final DslParser dslParser;

    public QueryCompiler() {
        this(new DslParser());
    }

    public QueryCompiler(DslParser dslParser) {
        this.dslParser = dslParser;
    }

    public Query compile(QuerySpec spec, QueryOptions options) throws QueryBuildException {
        log.debug("Compiling {} query for table {}", spec.getClass().getSimpleName(), options.getTableName());
        return spec.toBuilder(dslParser, options).build();
    }

    public HistogramQueryBuilder histogram(QueryOptions options, HistogramInterval interval, String dslFilter) {
        return new HistogramQueryBuilder(dslParser, options, interval, dslFilter);
    }

    public LogContextQueryBuilder context(QueryOptions options, long targetTimestampMillis, int beforeLimit, int afterLimit) {
        return new LogContextQueryBuilder(options, targetTimestampMillis, beforeLimit, afterLimit);
    }
}
