package com.rulesdsl.engine;

import com.rulesdsl.action.RuleMessage;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.evaluation.ConditionEvaluationResult;

import java.util.List;
import java.util.Map;

/**
 * Result of evaluating one rule against one context.
 */
public interface EvaluationResult {

    /**
     * Check if the rule's IF group matched.
     */
    boolean isMatched();

    /**
     * Get the per-condition trace, in evaluation order.
     */
    List<ConditionEvaluationResult> getConditionResults();

    /**
     * Get the actions of the selected branch (THEN if matched, else ELSE).
     */
    List<Action> getApplicableActions();

    /**
     * Get messages produced by the selected branch.
     */
    List<RuleMessage> getMessages();

    /**
     * Check if the selected branch blocks the transaction.
     */
    boolean isBlocked();

    /**
     * Get intended context changes. The context itself is never modified.
     */
    Map<String, Object> getContextDelta();
}
