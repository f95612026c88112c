package org.carball.logquery.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.dsl.DslParser;
import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;

import java.time.Duration;

/**
 * Counts log rows per time bucket between the configured start and end, optionally
 * narrowed by a DSL filter. Buckets are reported as epoch milliseconds in column
 * {@code ts}.
 */
@Slf4j
public class HistogramQueryBuilder implements QueryBuilder {

    private final DslParser parser;
    private final QueryOptions options;
    private final HistogramInterval interval;
    private final String dslFilter;

    public HistogramQueryBuilder(DslParser parser, QueryOptions options, HistogramInterval interval, String dslFilter) {
        this.parser = parser;
        this.options = options;
        this.interval = interval;
        this.dslFilter = dslFilter;
    }

    @Override
    public Query build() throws QueryBuildException {
        String table = SqlFragments.requireTableName(options);
        if (options.getStartTime() == null || options.getEndTime() == null) {
            throw new QueryConfigException("timeRange", "histogram queries require both start and end time");
        }

        HistogramInterval bucket = interval != null
                ? interval
                : HistogramInterval.forRange(Duration.between(options.getStartTime(), options.getEndTime()));
        String timestamp = SqlFragments.timestampColumn(options);

        SelectStatement select = new SelectStatement(
                "toUnixTimestamp(" + bucket.getFunction() + "(" + timestamp + ")) * 1000 AS ts, count() AS count", table);
        SqlFragments.appendTimeRange(select, options);
        if (dslFilter != null && !dslFilter.isBlank()) {
            DslQueryBuilder.appendFilters(select, parser.parse(dslFilter));
        }
        select.groupBy("ts").orderBy("ts ASC");

        Query query = select.toQuery();
        log.debug("Built {} histogram query: {}", bucket, query.sql());
        return query;
    }
}
