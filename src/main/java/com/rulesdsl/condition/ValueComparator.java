package com.rulesdsl.condition;

import com.rulesdsl.dsl.ConditionOperator;

/**
 * Compares a field value with an expected value under a condition operator.
 */
public interface ValueComparator {

    /**
     * Apply an operator.
     *
     * @param operator Condition operator
     * @param actual   Actual field value (null if absent)
     * @param expected Expected value (null if absent)
     * @return true if the comparison holds; false on any type mismatch
     */
    boolean compare(ConditionOperator operator, Object actual, Object expected);
}
