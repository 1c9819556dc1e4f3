package com.rulesdsl.evaluation;

import com.rulesdsl.dsl.Condition;

/**
 * Outcome of evaluating one condition, kept for diagnostics and audit.
 *
 * @param condition     The evaluated condition
 * @param matched       Whether it held
 * @param actualValue   Value resolved from the context (null if absent)
 * @param expectedValue Value declared in the condition
 * @param fieldPath     Field path that was resolved
 */
public record ConditionEvaluationResult(
        Condition condition,
        boolean matched,
        Object actualValue,
        Object expectedValue,
        String fieldPath
) {
    @Override
    public String toString() {
        return fieldPath + " " + (condition.operator() != null ? condition.operator().getWireName() : "?")
                + " " + expectedValue + " (actual: " + actualValue + ") = " + matched;
    }
}
