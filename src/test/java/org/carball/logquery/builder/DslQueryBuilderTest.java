package org.carball.logquery.builder;

import org.carball.logquery.dsl.DslParser;
import org.carball.logquery.error.LexicalException;
import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.error.QuerySyntaxException;
import org.carball.logquery.error.SemanticException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;
import org.carball.logquery.model.query.SortOptions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DslQueryBuilderTest {

    private final DslParser parser = new DslParser();

    private Query build(String dsl) throws Exception {
        return build(dsl, QueryOptions.forTable("logs"));
    }

    private Query build(String dsl, QueryOptions options) throws Exception {
        return new DslQueryBuilder(parser, dsl, options).build();
    }

    @Test
    public void shouldCompileConjunctionOfEqualities() throws Exception {
        Query query = build("service_name='api';severity_text='error'");

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE service_name = ? AND severity_text = ?");
        assertThat(query.args()).containsExactly("api", "error");
    }

    @Test
    public void shouldExtractNestedPayloadField() throws Exception {
        Query query = build("p.error.code=500");

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE JSONExtractString(p, ?) = ?");
        assertThat(query.args()).containsExactly("error.code", "500");
    }

    @Test
    public void shouldExtractFromNamedMapColumn() throws Exception {
        Query query = build("attributes.user.id='42'");

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE JSONExtractString(attributes, ?) = ?");
        assertThat(query.args()).containsExactly("user.id", "42");
    }

    @Test
    public void shouldCompileRelativeTime() throws Exception {
        Query query = build("timestamp>-1h");

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE timestamp > now() - INTERVAL ?");
        assertThat(query.args()).containsExactly("-1h");
    }

    @Test
    public void shouldRejectInvalidRelativeTimeUnit() {
        assertThatThrownBy(() -> build("timestamp>-1x"))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("Invalid time unit");
    }

    @Test
    public void shouldRejectZeroRelativeTime() {
        assertThatThrownBy(() -> build("timestamp>-0h"))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("cannot be zero");
    }

    @Test
    public void shouldKeepNegativeNumbersAsValues() throws Exception {
        Query query = build("status_code>-500");

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE status_code > ?");
        assertThat(query.args()).containsExactly("-500");
    }

    @Test
    public void shouldWrapPatternValuesInWildcards() throws Exception {
        Query query = build("message~'timeout';message!~'retry'");

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE message ILIKE ? AND message NOT ILIKE ?");
        assertThat(query.args()).containsExactly("%timeout%", "%retry%");
    }

    @Test
    public void shouldMatchEverythingForEmptyPattern() throws Exception {
        Query query = build("service_name~''");

        assertThat(query.args()).containsExactly("%%");
    }

    @Test
    public void shouldTreatRelativeTimeAsTextUnderPatternOperator() throws Exception {
        Query query = build("message~-5m");

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE message ILIKE ?");
        assertThat(query.args()).containsExactly("%-5m%");
    }

    @Test
    public void shouldPlaceTimeRangeBeforeFilters() throws Exception {
        QueryOptions options = QueryOptions.builder()
                .tableName("default.logs")
                .startTime(Instant.parse("2024-01-01T00:00:00Z"))
                .endTime(Instant.parse("2024-01-01T01:00:00.250Z"))
                .limit(50)
                .sort(SortOptions.descending("timestamp"))
                .build();

        Query query = build("level='error'", options);

        assertThat(query.sql()).isEqualTo("SELECT * FROM default.logs"
                + " WHERE timestamp >= toDateTime64(?, 3) AND timestamp <= toDateTime64(?, 3) AND level = ?"
                + " ORDER BY timestamp DESC LIMIT 50");
        assertThat(query.args()).containsExactly("2024-01-01 00:00:00.000", "2024-01-01 01:00:00.250", "error");
    }

    @Test
    public void shouldNotAddOrderingWithoutSort() throws Exception {
        Query query = build("level='error'", QueryOptions.builder().tableName("logs").limit(10).build());

        assertThat(query.sql()).isEqualTo("SELECT * FROM logs WHERE level = ? LIMIT 10");
    }

    @Test
    public void shouldUseConfiguredTimestampColumn() throws Exception {
        QueryOptions options = QueryOptions.builder()
                .tableName("logs")
                .timestampField("event_time")
                .startTime(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        Query query = build("level='warn'", options);

        assertThat(query.sql()).startsWith("SELECT * FROM logs WHERE event_time >= toDateTime64(?, 3) AND level = ?");
    }

    @Test
    public void shouldHaveOnePlaceholderPerArgument() throws Exception {
        Query query = build("p.a.b='x';c~'y';timestamp>=-15m;d<=3.5");

        long placeholders = query.sql().chars().filter(c -> c == '?').count();
        assertThat(placeholders).isEqualTo(query.argumentCount());
    }

    @Test
    public void shouldBeDeterministic() throws Exception {
        String dsl = "service_name='api';p.error.code=500;timestamp>-1h";

        assertThat(build(dsl)).isEqualTo(build(dsl));
    }

    @Test
    public void shouldRequireTableName() {
        assertThatThrownBy(() -> build("a='1'", QueryOptions.builder().build()))
                .isInstanceOf(QueryConfigException.class)
                .hasMessageContaining("tableName");
    }

    @Test
    public void shouldRejectInvalidTableName() {
        assertThatThrownBy(() -> build("a='1'", QueryOptions.forTable("logs; DROP TABLE x")))
                .isInstanceOf(QueryConfigException.class)
                .hasMessageContaining("invalid table name");
    }

    @Test
    public void shouldRejectStartAfterEnd() {
        QueryOptions options = QueryOptions.builder()
                .tableName("logs")
                .startTime(Instant.parse("2024-01-02T00:00:00Z"))
                .endTime(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        assertThatThrownBy(() -> build("a='1'", options))
                .isInstanceOf(QueryConfigException.class)
                .hasMessageContaining("start time cannot be after end time");
    }

    @Test
    public void shouldSurfaceParserErrors() {
        assertThatThrownBy(() -> build("level=")).isInstanceOf(QuerySyntaxException.class);
        assertThatThrownBy(() -> build("level='x")).isInstanceOf(LexicalException.class);
    }
}
