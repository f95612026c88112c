package org.carball.logquery.sql;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TableReferenceTest {

    @Test
    public void shouldParseQualifiedAndQuotedNames() {
        assertThat(TableReference.parse("logs")).isEqualTo(new TableReference(null, "logs"));
        assertThat(TableReference.parse("prod.logs")).isEqualTo(new TableReference("prod", "logs"));
        assertThat(TableReference.parse("`prod`.\"logs\"")).isEqualTo(new TableReference("prod", "logs"));
    }

    @Test
    public void shouldResolveAgainstAllowedTable() {
        TableReference allowed = TableReference.parse("prod.logs");

        assertThat(TableReference.parse("logs").resolvesTo(allowed)).isTrue();
        assertThat(TableReference.parse("prod.logs").resolvesTo(allowed)).isTrue();
        assertThat(TableReference.parse("other.logs").resolvesTo(allowed)).isFalse();
        assertThat(TableReference.parse("prod.users").resolvesTo(allowed)).isFalse();
        assertThat(TableReference.parse("Logs").resolvesTo(allowed)).isFalse();
    }

    @Test
    public void shouldRequireUnqualifiedMatchForUnqualifiedAllowedTable() {
        TableReference allowed = TableReference.parse("logs");

        assertThat(TableReference.parse("logs").resolvesTo(allowed)).isTrue();
        assertThat(TableReference.parse("prod.logs").resolvesTo(allowed)).isFalse();
    }

    @Test
    public void shouldNeverMatchThreePartNames() {
        assertThat(TableReference.parse("a.prod.logs").resolvesTo(TableReference.parse("prod.logs"))).isFalse();
    }

    @Test
    public void shouldRenderWithQualifier() {
        assertThat(TableReference.parse("`prod`.`logs`").toString()).isEqualTo("prod.logs");
        assertThat(TableReference.parse("logs").isQualified()).isFalse();
    }
}
