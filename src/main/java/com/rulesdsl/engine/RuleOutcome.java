package com.rulesdsl.engine;

/**
 * Evaluation result of one stored rule within a rule set.
 *
 * @param ruleId   Rule id
 * @param ruleName Rule name
 * @param priority Rule priority
 * @param result   Evaluation result
 */
public record RuleOutcome(String ruleId, String ruleName, int priority, EvaluationResult result) {
}
