package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.dsl.ConditionOperator;

/**
 * String suffix test. Both values must be strings.
 */
public class EndsWithComparison implements Comparison {

    @Override
    public boolean test(Object actual, Object expected) {
        return actual instanceof String str
                && expected instanceof String suffix
                && str.endsWith(suffix);
    }

    @Override
    public ConditionOperator getOperator() {
        return ConditionOperator.ENDS_WITH;
    }

    @Override
    public String toString() {
        return "ENDS_WITH";
    }
}
