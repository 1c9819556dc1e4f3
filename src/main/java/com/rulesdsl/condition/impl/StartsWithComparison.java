package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.dsl.ConditionOperator;

/**
 * String prefix test. Both values must be strings.
 */
public class StartsWithComparison implements Comparison {

    @Override
    public boolean test(Object actual, Object expected) {
        return actual instanceof String str
                && expected instanceof String prefix
                && str.startsWith(prefix);
    }

    @Override
    public ConditionOperator getOperator() {
        return ConditionOperator.STARTS_WITH;
    }

    @Override
    public String toString() {
        return "STARTS_WITH";
    }
}
