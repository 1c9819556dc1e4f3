package com.rulesdsl.evaluation;

import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.ConditionNode;
import com.rulesdsl.dsl.LogicalOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a condition group recursively.
 * <p>
 * Rules:
 * - Children are evaluated in declaration order
 * - AND stops at the first false child, OR stops at the first true child
 * - Children after the stopping point are not evaluated and do not appear in the results
 * - A nested group counts as one child; its results are flattened into the parent's
 * - Without an early stop, AND yields true and OR yields false (so an empty AND is true
 *   and an empty OR is false)
 */
public class ConditionGroupEvaluator {

    private final ConditionEvaluator conditionEvaluator;

    public ConditionGroupEvaluator(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * Evaluate a group against a context.
     *
     * @param group   Condition group
     * @param context Evaluation context
     * @return Matched flag and the per-condition trace
     */
    public GroupEvaluationResult evaluate(ConditionGroup group, EvaluationContext context) {
        List<ConditionEvaluationResult> results = new ArrayList<>();
        boolean matched = evaluateGroup(group, context, results);
        return new GroupEvaluationResult(matched, results);
    }

    /**
     * Recursive evaluation.
     *
     * @param results Accumulated trace (mutated)
     */
    private boolean evaluateGroup(ConditionGroup group, EvaluationContext context,
                                  List<ConditionEvaluationResult> results) {
        boolean isAnd = group.op() == LogicalOperator.AND;

        for (ConditionNode node : group.conditions()) {
            boolean childMatched = switch (node.nodeType()) {
                case LEAF -> evaluateLeaf((Condition) node, context, results);
                case GROUP -> evaluateGroup((ConditionGroup) node, context, results);
            };

            if (isAnd && !childMatched) {
                return false;
            }
            if (!isAnd && childMatched) {
                return true;
            }
        }

        return isAnd;
    }

    private boolean evaluateLeaf(Condition condition, EvaluationContext context,
                                 List<ConditionEvaluationResult> results) {
        ConditionEvaluationResult result = conditionEvaluator.evaluate(condition, context);
        results.add(result);
        return result.matched();
    }
}
