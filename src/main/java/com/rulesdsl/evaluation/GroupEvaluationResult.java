package com.rulesdsl.evaluation;

import java.util.List;

/**
 * Aggregated outcome of a condition group.
 *
 * @param matched Whether the group held
 * @param results Per-condition results in evaluation order; conditions skipped by
 *                short-circuiting are absent
 */
public record GroupEvaluationResult(
        boolean matched,
        List<ConditionEvaluationResult> results
) {
    public GroupEvaluationResult {
        results = List.copyOf(results);
    }
}
