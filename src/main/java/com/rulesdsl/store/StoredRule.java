package com.rulesdsl.store;

import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.dsl.RuleStatus;

import java.time.Instant;

/**
 * A persisted rule.
 *
 * @param id        Rule id
 * @param productId Owning product
 * @param draft     Rule content, including logic
 * @param ai        AI provenance
 * @param createdAt Creation time
 * @param updatedAt Time of the last logic update
 */
public record StoredRule(
        String id,
        String productId,
        RuleDraft draft,
        AiMetadata ai,
        Instant createdAt,
        Instant updatedAt
) {

    public String name() {
        return draft.name();
    }

    public int priority() {
        return draft.priority();
    }

    public RuleLogic logic() {
        return draft.logic();
    }

    public boolean isActive() {
        return draft.status() == RuleStatus.ACTIVE;
    }
}
