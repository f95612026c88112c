package org.carball.logquery.model.filter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One already-parsed condition. {@code value} is a scalar for most operators, a list
 * for {@link FilterOperator#IN} and {@link FilterOperator#NOT_IN}, and ignored for the
 * null checks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterCondition {
    private String field;
    private FilterOperator operator;
    private Object value;

    public static FilterCondition of(String field, FilterOperator operator, Object value) {
        return new FilterCondition(field, operator, value);
    }
}
