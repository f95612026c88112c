package org.carball.logquery.sql;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DisallowedNodeFinderTest {

    private static Expression expression(String sql) throws Exception {
        return CCJSqlParserUtil.parseCondExpression(sql);
    }

    @Test
    public void shouldAcceptOrdinaryPredicates() throws Exception {
        DisallowedNodeFinder finder = new DisallowedNodeFinder();

        assertThat(finder.inspect(expression("level = 'error' AND status >= 500"))).isEmpty();
        assertThat(finder.inspect(null)).isEmpty();
    }

    @Test
    public void shouldIgnoreKeywordsInStringLiterals() throws Exception {
        assertThat(new DisallowedNodeFinder().inspect(expression("message = 'DROP TABLE logs'"))).isEmpty();
    }

    @Test
    public void shouldFlagDeniedIdentifiers() throws Exception {
        assertThat(new DisallowedNodeFinder().inspect(expression("`drop` = 1")))
                .hasValueSatisfying(v -> assertThat(v).startsWith("dangerous operation detected: identifier"));
    }

    @Test
    public void shouldFlagNestedSelect() throws Exception {
        assertThat(new DisallowedNodeFinder().inspect(expression("id IN (SELECT id FROM users)")))
                .contains("subqueries are not allowed");
    }

    @Test
    public void shouldFlagExistsAndScalarSubqueries() throws Exception {
        assertThat(new DisallowedNodeFinder().inspect(expression("EXISTS (SELECT 1 FROM users)")))
                .contains("subqueries are not allowed");
        assertThat(new DisallowedNodeFinder().inspect(expression("x = (SELECT max(id) FROM users)")))
                .contains("subqueries are not allowed");
        assertThat(new DisallowedNodeFinder().inspect(expression("CASE WHEN 1 = 1 THEN (SELECT 1 FROM users) END = 1")))
                .contains("subqueries are not allowed");
    }

    @Test
    public void shouldKeepFirstViolation() throws Exception {
        DisallowedNodeFinder finder = new DisallowedNodeFinder();
        finder.inspect(expression("`delete` = 1"));

        assertThat(finder.inspect(expression("id IN (SELECT id FROM users)")))
                .hasValueSatisfying(v -> assertThat(v).contains("`delete`"));
    }
}
