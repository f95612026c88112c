package org.carball.logquery.model.filter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterGroup {

    @Builder.Default
    private GroupOperator operator = GroupOperator.AND;

    @Builder.Default
    private List<FilterCondition> conditions = new ArrayList<>();

    public static FilterGroup and(FilterCondition... conditions) {
        return new FilterGroup(GroupOperator.AND, new ArrayList<>(List.of(conditions)));
    }

    public static FilterGroup or(FilterCondition... conditions) {
        return new FilterGroup(GroupOperator.OR, new ArrayList<>(List.of(conditions)));
    }

    public boolean isEmpty() {
        return conditions == null || conditions.isEmpty();
    }
}
