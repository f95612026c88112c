package org.carball.logquery.builder;

import org.carball.logquery.error.QueryConfigException;
import org.carball.logquery.error.QuerySecurityException;
import org.carball.logquery.model.filter.FilterCondition;
import org.carball.logquery.model.filter.FilterGroup;
import org.carball.logquery.model.filter.FilterOperator;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;
import org.carball.logquery.model.request.LogQueryRequest;
import org.carball.logquery.model.request.QueryMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryCompilerTest {

    private final QueryCompiler compiler = new QueryCompiler();
    private final QueryOptions options = QueryOptions.forTable("logs");

    @Test
    public void shouldDispatchEachMode() throws Exception {
        Query dsl = compiler.compile(QuerySpec.dsl("level='error'"), options);
        Query filters = compiler.compile(QuerySpec.filters(List.of(
                FilterGroup.and(FilterCondition.of("level", FilterOperator.EQUALS, "error")))), options);
        Query raw = compiler.compile(QuerySpec.rawSql("SELECT * FROM logs"), options);

        assertThat(dsl.sql()).isEqualTo("SELECT * FROM logs WHERE level = ?");
        assertThat(filters.sql()).isEqualTo("SELECT * FROM logs WHERE level = ? ORDER BY timestamp DESC");
        assertThat(raw.sql()).isEqualTo("SELECT * FROM logs");
    }

    @Test
    public void shouldProduceEquivalentPredicatesForDslAndFilters() throws Exception {
        Query dsl = compiler.compile(QuerySpec.dsl("a='x';b='y'"), options);
        Query filters = compiler.compile(QuerySpec.filters(List.of(FilterGroup.and(
                FilterCondition.of("a", FilterOperator.EQUALS, "x"),
                FilterCondition.of("b", FilterOperator.EQUALS, "y")))), options);

        assertThat(whereClause(dsl)).isEqualTo("a = ? AND b = ?");
        assertThat(whereClause(filters)).isEqualTo("(a = ? AND b = ?)");
        assertThat(dsl.args()).isEqualTo(filters.args());
    }

    @Test
    public void shouldSurfaceBuilderErrors() {
        assertThatThrownBy(() -> compiler.compile(QuerySpec.rawSql("SELECT * FROM users"), options))
                .isInstanceOf(QuerySecurityException.class);
        assertThatThrownBy(() -> compiler.compile(QuerySpec.dsl("a='1'"), QueryOptions.builder().build()))
                .isInstanceOf(QueryConfigException.class);
    }

    @Test
    public void shouldSelectSpecFromRequestMode() throws Exception {
        LogQueryRequest request = LogQueryRequest.builder()
                .mode(QueryMode.DSL)
                .query("a='1'")
                .rawSql("SELECT * FROM ignored")
                .build();

        assertThat(QuerySpec.from(request)).isEqualTo(new QuerySpec.Dsl("a='1'"));

        request.setMode(QueryMode.SQL);
        assertThat(QuerySpec.from(request)).isEqualTo(new QuerySpec.RawSql("SELECT * FROM ignored"));

        request.setMode(QueryMode.FILTERS);
        assertThat(QuerySpec.from(request)).isEqualTo(new QuerySpec.Filters(List.of()));
    }

    @Test
    public void shouldRequireModeInRequest() {
        assertThatThrownBy(() -> QuerySpec.from(new LogQueryRequest()))
                .isInstanceOf(QueryConfigException.class)
                .hasMessageContaining("mode");
    }

    private static String whereClause(Query query) {
        String sql = query.sql();
        int start = sql.indexOf(" WHERE ") + " WHERE ".length();
        int end = sql.indexOf(" ORDER BY ");
        return end < 0 ? sql.substring(start) : sql.substring(start, end);
    }
}
