package com.rulesdsl.condition;

import com.rulesdsl.condition.impl.BetweenComparison;
import com.rulesdsl.condition.impl.ContainsComparison;
import com.rulesdsl.condition.impl.EndsWithComparison;
import com.rulesdsl.condition.impl.EqualsComparison;
import com.rulesdsl.condition.impl.ExistsComparison;
import com.rulesdsl.condition.impl.InComparison;
import com.rulesdsl.condition.impl.NumericComparison;
import com.rulesdsl.condition.impl.RegexComparison;
import com.rulesdsl.condition.impl.StartsWithComparison;
import com.rulesdsl.dsl.ConditionOperator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default implementation of ValueComparator.
 * Builds one stateless Comparison per operator up front and dispatches on the operator.
 */
public class DefaultValueComparator implements ValueComparator {

    private final Map<ConditionOperator, Comparison> comparisons;

    public DefaultValueComparator() {
        Map<ConditionOperator, Comparison> map = new EnumMap<>(ConditionOperator.class);
        for (ConditionOperator operator : ConditionOperator.values()) {
            map.put(operator, create(operator));
        }
        this.comparisons = Collections.unmodifiableMap(map);
    }

    @Override
    public boolean compare(ConditionOperator operator, Object actual, Object expected) {
        if (operator == null) {
            return false;
        }
        return comparisons.get(operator).test(actual, expected);
    }

    /**
     * Get the comparison registered for an operator.
     */
    public Comparison getComparison(ConditionOperator operator) {
        return comparisons.get(operator);
    }

    private static Comparison create(ConditionOperator operator) {
        return switch (operator) {
            case EQUALS -> EqualsComparison.equalTo();
            case NOT_EQUALS -> EqualsComparison.notEqualTo();

            case IN -> InComparison.in();
            case NOT_IN -> InComparison.notIn();

            case GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS ->
                    new NumericComparison(operator);
            case BETWEEN -> new BetweenComparison();

            case CONTAINS -> ContainsComparison.contains();
            case NOT_CONTAINS -> ContainsComparison.notContains();

            case EXISTS -> ExistsComparison.exists();
            case NOT_EXISTS -> ExistsComparison.notExists();

            case STARTS_WITH -> new StartsWithComparison();
            case ENDS_WITH -> new EndsWithComparison();
            case MATCHES -> new RegexComparison();
        };
    }
}
