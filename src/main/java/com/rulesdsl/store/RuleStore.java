package com.rulesdsl.store;

import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for rules authored through the rule builder.
 */
public interface RuleStore {

    /**
     * Save a draft as a new rule of a product.
     *
     * @return The new rule id
     */
    String saveRule(String productId, RuleDraft draft);

    /**
     * Replace the logic and texts of an existing rule and bump its refinement count.
     *
     * @throws com.rulesdsl.exception.RuleNotFoundException if no rule has this id
     */
    StoredRule updateRuleLogic(String ruleId, RuleLogic logic, String conditionText, String outcomeText);

    Optional<StoredRule> findById(String ruleId);

    /**
     * All rules of a product, in save order.
     */
    List<StoredRule> findByProduct(String productId);
}
