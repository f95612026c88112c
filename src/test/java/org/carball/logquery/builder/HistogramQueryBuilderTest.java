package org.carball.logquery.builder;

import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.error.QuerySyntaxException;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HistogramQueryBuilderTest {

    private final QueryCompiler compiler = new QueryCompiler();

    private final QueryOptions sixHours = QueryOptions.builder()
            .tableName("logs")
            .startTime(Instant.parse("2024-01-01T00:00:00Z"))
            .endTime(Instant.parse("2024-01-01T06:00:00Z"))
            .limit(100)
            .build();

    @Test
    public void shouldCountPerBucket() throws Exception {
        Query query = compiler.histogram(sixHours, HistogramInterval.HOUR, null).build();

        assertThat(query.sql()).isEqualTo("SELECT toUnixTimestamp(toStartOfHour(timestamp)) * 1000 AS ts, count() AS count"
                + " FROM logs WHERE timestamp >= toDateTime64(?, 3) AND timestamp <= toDateTime64(?, 3)"
                + " GROUP BY ts ORDER BY ts ASC");
        assertThat(query.args()).containsExactly("2024-01-01 00:00:00.000", "2024-01-01 06:00:00.000");
    }

    @Test
    public void shouldAndDslFilter() throws Exception {
        Query query = compiler.histogram(sixHours, HistogramInterval.MINUTE, "level='error';p.code=500").build();

        assertThat(query.sql()).contains("toStartOfMinute(timestamp)")
                .contains("AND level = ? AND JSONExtractString(p, ?) = ? GROUP BY ts");
        assertThat(query.args()).containsExactly(
                "2024-01-01 00:00:00.000", "2024-01-01 06:00:00.000", "error", "code", "500");
    }

    @Test
    public void shouldPickIntervalFromRange() throws Exception {
        Query query = compiler.histogram(sixHours, null, "").build();

        assertThat(query.sql()).contains("toStartOfFiveMinutes(timestamp)");
    }

    @Test
    public void shouldRequireBothEndsOfRange() {
        QueryOptions openEnded = sixHours.toBuilder().endTime(null).build();

        assertThatThrownBy(() -> compiler.histogram(openEnded, HistogramInterval.HOUR, null).build())
                .isInstanceOf(QueryConfigException.class)
                .hasMessageContaining("timeRange");
    }

    @Test
    public void shouldRejectInvalidFilter() {
        assertThatThrownBy(() -> compiler.histogram(sixHours, HistogramInterval.HOUR, "level=").build())
                .isInstanceOf(QuerySyntaxException.class);
    }

    @Test
    public void shouldChooseFinestIntervalUnderBucketCap() {
        assertThat(HistogramInterval.forRange(Duration.ofMinutes(30))).isEqualTo(HistogramInterval.MINUTE);
        assertThat(HistogramInterval.forRange(Duration.ofHours(2))).isEqualTo(HistogramInterval.MINUTE);
        assertThat(HistogramInterval.forRange(Duration.ofHours(6))).isEqualTo(HistogramInterval.FIVE_MINUTES);
        assertThat(HistogramInterval.forRange(Duration.ofHours(24))).isEqualTo(HistogramInterval.FIFTEEN_MINUTES);
        assertThat(HistogramInterval.forRange(Duration.ofDays(3))).isEqualTo(HistogramInterval.HOUR);
        assertThat(HistogramInterval.forRange(Duration.ofDays(30))).isEqualTo(HistogramInterval.DAY);
        assertThat(HistogramInterval.forRange(Duration.ofDays(365))).isEqualTo(HistogramInterval.DAY);
    }

    @Test
    public void shouldResolveIntervalNames() {
        assertThat(HistogramInterval.fromName("hour")).isEqualTo(HistogramInterval.HOUR);
        assertThat(HistogramInterval.fromName("five-minutes")).isEqualTo(HistogramInterval.FIVE_MINUTES);
        assertThatThrownBy(() -> HistogramInterval.fromName("week"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("week");
    }
}
