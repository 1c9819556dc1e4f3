package com.rulesdsl.condition;

import com.rulesdsl.dsl.ConditionOperator;

/**
 * A single comparison operator applied to an actual and an expected value.
 * Implementations are total: a type mismatch yields false, never an exception.
 */
public interface Comparison {

    /**
     * Test the actual value against the expected value.
     *
     * @param actual   Value resolved from the context, null if absent
     * @param expected Value declared in the condition, null if absent
     * @return true if the comparison holds
     */
    boolean test(Object actual, Object expected);

    /**
     * Get the operator this comparison implements.
     */
    ConditionOperator getOperator();
}
