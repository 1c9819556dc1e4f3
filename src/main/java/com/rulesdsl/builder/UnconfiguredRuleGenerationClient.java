package com.rulesdsl.builder;

import com.rulesdsl.exception.RulesException;

import java.util.List;

/**
 * Placeholder used when no model client bean is defined. Every call fails.
 */
public class UnconfiguredRuleGenerationClient implements RuleGenerationClient {

    @Override
    public String chat(List<ChatMessage> messages, int maxTokens, double temperature) {
        throw new RulesException("No RuleGenerationClient configured");
    }
}
