package com.rulesdsl.builder;

import java.util.List;

/**
 * Chat-completion collaborator that turns a conversation into a reply.
 * Implementations wrap a language model endpoint.
 */
public interface RuleGenerationClient {

    /**
     * Send a conversation and return the reply text.
     *
     * @param messages    System prompt, history and the new user message
     * @param maxTokens   Reply size limit
     * @param temperature Sampling temperature
     * @return Reply content, never null
     * @throws com.rulesdsl.exception.RulesException if the call fails
     */
    String chat(List<ChatMessage> messages, int maxTokens, double temperature);
}
