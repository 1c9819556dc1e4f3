package com.rulesdsl.builder;

import com.rulesdsl.dsl.RuleDraft;

/**
 * Reply of the rule builder.
 *
 * @param success       Whether the collaborator call succeeded
 * @param draft         Generated draft, when one was recognized
 * @param message       Conversational text
 * @param error         Failure reason when not successful
 * @param confidence    Confidence (0-100) when a draft is present
 * @param needsMoreInfo Whether the model is asking for clarification
 */
public record RuleBuilderResponse(
        boolean success,
        RuleDraft draft,
        String message,
        String error,
        Integer confidence,
        boolean needsMoreInfo
) {

    public static RuleBuilderResponse draft(RuleDraft draft, String message, int confidence) {
        return new RuleBuilderResponse(true, draft, message, null, confidence, false);
    }

    public static RuleBuilderResponse conversation(String message) {
        return new RuleBuilderResponse(true, null, message, null, null, true);
    }

    public static RuleBuilderResponse failure(String error) {
        return new RuleBuilderResponse(false, null, null, error, null, false);
    }

    public boolean hasDraft() {
        return draft != null;
    }
}
