package com.rulesdsl.evaluation;

import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.dsl.Condition;

/**
 * Evaluates a single condition against a context.
 */
public interface ConditionEvaluator {

    /**
     * Resolve the condition's field and compare it with the expected value.
     * Never throws: unresolvable fields and type mismatches yield an unmatched result.
     *
     * @param condition Condition to evaluate
     * @param context   Evaluation context
     * @return Result carrying both operands for diagnostics
     */
    ConditionEvaluationResult evaluate(Condition condition, EvaluationContext context);
}
