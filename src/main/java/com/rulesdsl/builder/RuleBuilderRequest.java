package com.rulesdsl.builder;

import java.util.List;

/**
 * A request to turn plain English into a rule.
 *
 * @param text           User message
 * @param productId      Product the rule belongs to
 * @param targetId       Optional coverage/form id
 * @param productContext Optional product facts
 * @param history        Earlier turns of the conversation
 */
public record RuleBuilderRequest(
        String text,
        String productId,
        String targetId,
        ProductContext productContext,
        List<ChatMessage> history
) {

    public RuleBuilderRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static RuleBuilderRequest of(String text, String productId) {
        return new RuleBuilderRequest(text, productId, null, null, List.of());
    }

    public boolean isFirstTurn() {
        return history.isEmpty();
    }
}
