package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.condition.Values;
import com.rulesdsl.dsl.ConditionOperator;

/**
 * Strict equality (EQUALS) or inequality (NOT_EQUALS). Applies to any type.
 */
public class EqualsComparison implements Comparison {

    private final boolean negated;

    private EqualsComparison(boolean negated) {
        this.negated = negated;
    }

    public static EqualsComparison equalTo() {
        return new EqualsComparison(false);
    }

    public static EqualsComparison notEqualTo() {
        return new EqualsComparison(true);
    }

    @Override
    public boolean test(Object actual, Object expected) {
        return Values.strictEquals(actual, expected) != negated;
    }

    @Override
    public ConditionOperator getOperator() {
        return negated ? ConditionOperator.NOT_EQUALS : ConditionOperator.EQUALS;
    }

    @Override
    public String toString() {
        return negated ? "!=" : "==";
    }
}
