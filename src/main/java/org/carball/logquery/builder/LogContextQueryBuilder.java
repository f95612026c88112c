package org.carball.logquery.builder;

import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;

/**
 * Builds the before/at/after queries used to show a log line in context.
 */
public class LogContextQueryBuilder {

    static final int MAX_CONTEXT_LIMIT = 1000;

    private final QueryOptions options;
    private final long targetTimestampMillis;
    private final int beforeLimit;
    private final int afterLimit;

    public LogContextQueryBuilder(QueryOptions options, long targetTimestampMillis, int beforeLimit, int afterLimit) {
        this.options = options;
        this.targetTimestampMillis = targetTimestampMillis;
        this.beforeLimit = beforeLimit;
        this.afterLimit = afterLimit;
    }

    public LogContextQueries build() throws QueryConfigException {
        validate();
        String table = SqlFragments.requireTableName(options);
        String timestamp = SqlFragments.timestampColumn(options);

        Query before = beforeLimit > 0
                ? around(table, timestamp, "<", "DESC", beforeLimit)
                : null;
        Query target = around(table, timestamp, "=", "ASC", 0);
        Query after = afterLimit > 0
                ? around(table, timestamp, ">", "ASC", afterLimit)
                : null;
        return new LogContextQueries(before, target, after);
    }

    private Query around(String table, String timestamp, String comparison, String direction, int limit) {
        return SelectStatement.selectAll(table)
                .where(timestamp + " " + comparison + " fromUnixTimestamp64Milli(?)", targetTimestampMillis)
                .orderBy(timestamp + " " + direction)
                .limit(limit)
                .toQuery();
    }

    private void validate() throws QueryConfigException {
        if (targetTimestampMillis <= 0) {
            throw new QueryConfigException("timestamp", "timestamp must be greater than 0");
        }
        if (beforeLimit < 0) {
            throw new QueryConfigException("before_limit", "before_limit cannot be negative");
        }
        if (afterLimit < 0) {
            throw new QueryConfigException("after_limit", "after_limit cannot be negative");
        }
        if (beforeLimit == 0 && afterLimit == 0) {
            throw new QueryConfigException("limits", "at least one of before_limit or after_limit must be greater than 0");
        }
        if (beforeLimit > MAX_CONTEXT_LIMIT) {
            throw new QueryConfigException("before_limit", "before_limit cannot be greater than " + MAX_CONTEXT_LIMIT);
        }
        if (afterLimit > MAX_CONTEXT_LIMIT) {
            throw new QueryConfigException("after_limit", "after_limit cannot be greater than " + MAX_CONTEXT_LIMIT);
        }
    }
}
