package org.carball.logquery.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.dsl.ast.FieldRef;
import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.error.SemanticException;
import org.carball.logquery.model.filter.FilterCondition;
import org.carball.logquery.model.filter.FilterGroup;
import org.carball.logquery.model.filter.FilterOperator;
import org.carball.logquery.model.filter.GroupOperator;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a SELECT from structured filter groups. Conditions inside a group are joined
 * with the group's operator and groups are OR-ed together; the time range is always
 * AND-ed on top.
 */
@Slf4j
public class FilterQueryBuilder implements QueryBuilder {

    private final List<FilterGroup> filterGroups;
    private final QueryOptions options;

    public FilterQueryBuilder(List<FilterGroup> filterGroups, QueryOptions options) {
        this.filterGroups = filterGroups == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(filterGroups));
        this.options = options;
    }

    @Override
    public Query build() throws QueryBuildException {
        String table = SqlFragments.requireTableName(options);

        SelectStatement select = SelectStatement.selectAll(table);
        SqlFragments.appendTimeRange(select, options);

        List<Object> filterArgs = new ArrayList<>();
        String filterClause = buildFilterClause(filterArgs);
        if (filterClause != null) {
            // An OR chain must not bind to the preceding time range predicates
            boolean needsWrapping = select.predicateCount() > 0 && countNonEmptyGroups() > 1;
            select.where(needsWrapping ? "(" + filterClause + ")" : filterClause, filterArgs);
        }

        SqlFragments.applySortAndLimit(select, options, true);

        Query query = select.toQuery();
        log.debug("Built filter query from {} group(s): {} ({} args)",
                filterGroups.size(), query.sql(), query.argumentCount());
        return query;
    }

    /**
     * Renders all groups, or returns {@code null} when there is nothing to filter on.
     */
    String buildFilterClause(List<Object> args) throws SemanticException {
        List<String> groupClauses = new ArrayList<>();
        boolean multipleGroups = countNonEmptyGroups() > 1;

        for (FilterGroup group : filterGroups) {
            if (group == null || group.isEmpty()) {
                continue;
            }
            groupClauses.add(buildGroup(group, multipleGroups, args));
        }

        if (groupClauses.isEmpty()) {
            return null;
        }
        return String.join(" OR ", groupClauses);
    }

    private String buildGroup(FilterGroup group, boolean multipleGroups, List<Object> args) throws SemanticException {
        List<String> conditions = new ArrayList<>();
        for (FilterCondition condition : group.getConditions()) {
            conditions.add(buildCondition(condition, args));
        }

        GroupOperator operator = group.getOperator() == null ? GroupOperator.AND : group.getOperator();
        String clause = String.join(operator.sqlKeyword(), conditions);

        if (conditions.size() > 1 || multipleGroups) {
            clause = "(" + clause + ")";
        }
        return clause;
    }

    String buildCondition(FilterCondition condition, List<Object> args) throws SemanticException {
        if (condition == null) {
            throw new SemanticException("Filter condition must not be null");
        }
        FilterOperator operator = condition.getOperator();
        if (operator == null) {
            throw new SemanticException("Unsupported operator null for field " + condition.getField());
        }

        FieldRef field = SqlFragments.parseField(condition.getField(), operator.getSymbol());
        if (field.isNested() && !operator.takesValue()) {
            throw new SemanticException("Unsupported operator " + operator + " for nested field " + condition.getField());
        }
        Object value = condition.getValue();
        validateValue(condition, operator, value);

        List<Object> bound = new ArrayList<>();
        String column = SqlFragments.column(field, bound);

        String sql = switch (operator) {
            case EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_EQUALS, LESS_THAN, LESS_EQUALS -> {
                bound.add(value);
                yield column + " " + operator.getSymbol() + " ?";
            }
            case CONTAINS -> {
                bound.add(value);
                yield "position(" + column + ", ?) > 0";
            }
            case NOT_CONTAINS -> {
                bound.add(value);
                yield "position(" + column + ", ?) = 0";
            }
            case ICONTAINS -> {
                bound.add(value);
                yield "positionCaseInsensitive(" + column + ", ?) > 0";
            }
            case STARTS_WITH -> {
                bound.add(value);
                yield "startsWith(" + column + ", ?)";
            }
            case ENDS_WITH -> {
                bound.add(value);
                yield "endsWith(" + column + ", ?)";
            }
            case IN, NOT_IN -> {
                Collection<?> values = (Collection<?>) value;
                bound.addAll(values);
                String placeholders = values.stream().map(v -> "?").collect(Collectors.joining(", "));
                yield column + (operator == FilterOperator.IN ? " IN (" : " NOT IN (") + placeholders + ")";
            }
            case IS_NULL -> column + " IS NULL";
            case IS_NOT_NULL -> column + " IS NOT NULL";
        };

        args.addAll(bound);
        return sql;
    }

    private static void validateValue(FilterCondition condition, FilterOperator operator, Object value)
            throws SemanticException {
        if (!operator.takesValue()) {
            return;
        }
        if (operator.takesList()) {
            if (!(value instanceof Collection<?> values)) {
                throw new SemanticException("Operator " + operator + " on field " + condition.getField()
                        + " requires a list value, got: " + value);
            }
            if (values.isEmpty()) {
                throw new SemanticException("Operator " + operator + " on field " + condition.getField()
                        + " requires at least one value");
            }
            return;
        }
        if (value == null) {
            throw new SemanticException("Operator " + operator + " on field " + condition.getField() + " requires a value");
        }
        if (value instanceof Collection<?>) {
            throw new SemanticException("Operator " + operator + " on field " + condition.getField()
                    + " does not accept a list value");
        }
    }

    private long countNonEmptyGroups() {
        return filterGroups.stream().filter(g -> g != null && !g.isEmpty()).count();
    }
}
