package com.rulesdsl.dsl;

/**
 * A candidate rule, typically produced by the AI rule builder, pending validation and persistence.
 *
 * @param name          Suggested rule name
 * @param ruleType      Entity the rule applies to
 * @param ruleCategory  Business category
 * @param targetId      Target coverage/form/pricing step, null for product rules
 * @param status        Initial status
 * @param proprietary   Whether the rule is proprietary
 * @param priority      Priority across rules of a product (0-100, higher first)
 * @param reference     Source document or regulation reference
 * @param sourceText    Original plain English text
 * @param conditionText Human-readable IF text
 * @param outcomeText   Human-readable THEN text
 * @param logic         Programmable logic
 */
public record RuleDraft(
        String name,
        RuleType ruleType,
        RuleCategory ruleCategory,
        String targetId,
        RuleStatus status,
        boolean proprietary,
        int priority,
        String reference,
        String sourceText,
        String conditionText,
        String outcomeText,
        RuleLogic logic
) {

    /**
     * Copy this draft with new logic and texts.
     */
    public RuleDraft withLogic(RuleLogic newLogic, String newConditionText, String newOutcomeText) {
        return new RuleDraft(name, ruleType, ruleCategory, targetId, status, proprietary, priority,
                reference, sourceText, newConditionText, newOutcomeText, newLogic);
    }

    /**
     * Minimal draft wrapping logic under a name, used by tests and the demo.
     */
    public static RuleDraft of(String name, RuleCategory category, RuleLogic logic) {
        return new RuleDraft(name, RuleType.PRODUCT, category, null, RuleStatus.ACTIVE, false, 0,
                null, "", "", "", logic);
    }
}
