package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.condition.Values;
import com.rulesdsl.dsl.ConditionOperator;

import java.util.Optional;

/**
 * Numeric comparison (>, >=, <, <=). Both operands must be numbers.
 */
public class NumericComparison implements Comparison {

    private final ConditionOperator operator;

    public NumericComparison(ConditionOperator operator) {
        if (operator != ConditionOperator.GREATER_THAN
                && operator != ConditionOperator.GREATER_THAN_OR_EQUALS
                && operator != ConditionOperator.LESS_THAN
                && operator != ConditionOperator.LESS_THAN_OR_EQUALS) {
            throw new IllegalArgumentException("Not a numeric comparison: " + operator);
        }
        this.operator = operator;
    }

    @Override
    public boolean test(Object actual, Object expected) {
        if (!(actual instanceof Number a) || !(expected instanceof Number b)) {
            return false;
        }
        Optional<Integer> result = Values.compareNumbers(a, b);
        if (result.isEmpty()) {
            return false;
        }

        int c = result.get();
        return switch (operator) {
            case GREATER_THAN -> c > 0;
            case GREATER_THAN_OR_EQUALS -> c >= 0;
            case LESS_THAN -> c < 0;
            case LESS_THAN_OR_EQUALS -> c <= 0;
            default -> false;
        };
    }

    @Override
    public ConditionOperator getOperator() {
        return operator;
    }

    @Override
    public String toString() {
        return switch (operator) {
            case GREATER_THAN -> ">";
            case GREATER_THAN_OR_EQUALS -> ">=";
            case LESS_THAN -> "<";
            case LESS_THAN_OR_EQUALS -> "<=";
            default -> "?";
        };
    }
}
