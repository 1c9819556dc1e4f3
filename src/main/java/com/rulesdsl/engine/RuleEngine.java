package com.rulesdsl.engine;

import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.dsl.RuleLogic;

/**
 * Evaluates programmable rule logic against a runtime context.
 * Stateless and side-effect free; safe to call from many threads at once.
 */
public interface RuleEngine {

    /**
     * Evaluate a rule.
     *
     * @param logic   Rule logic (never modified)
     * @param context Evaluation context (never modified)
     * @return A fresh result
     */
    EvaluationResult evaluate(RuleLogic logic, EvaluationContext context);
}
