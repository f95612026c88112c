package org.carball.logquery.dsl;

import org.carball.logquery.error.SemanticException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RelativeTimeTest {

    @Test
    public void shouldParseEachUnit() throws Exception {
        assertThat(RelativeTime.parse("-30s").toDuration()).isEqualTo(Duration.ofSeconds(30));
        assertThat(RelativeTime.parse("-15m").toDuration()).isEqualTo(Duration.ofMinutes(15));
        assertThat(RelativeTime.parse("-1h").toDuration()).isEqualTo(Duration.ofHours(1));
        assertThat(RelativeTime.parse("-7d").toDuration()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    public void shouldKeepLiteral() throws Exception {
        RelativeTime time = RelativeTime.parse("-24h");

        assertThat(time.magnitude()).isEqualTo(24);
        assertThat(time.unit()).isEqualTo("h");
        assertThat(time.literal()).isEqualTo("-24h");
    }

    @Test
    public void shouldRejectInvalidUnit() {
        assertThatThrownBy(() -> RelativeTime.parse("-1x"))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("Invalid time unit 'x'");
    }

    @Test
    public void shouldRejectZeroMagnitude() {
        assertThatThrownBy(() -> RelativeTime.parse("-0h"))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("cannot be zero");
    }

    @Test
    public void shouldRejectCompoundInterval() {
        assertThatThrownBy(() -> RelativeTime.parse("-1h30m"))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("Invalid time unit 'h30m'");
    }

    @Test
    public void shouldRejectMissingSignOrDigits() {
        assertThatThrownBy(() -> RelativeTime.parse("1h"))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("must start with -");
        assertThatThrownBy(() -> RelativeTime.parse("-h"))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("Invalid time interval format");
    }
}
