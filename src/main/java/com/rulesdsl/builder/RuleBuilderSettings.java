package com.rulesdsl.builder;

import com.rulesdsl.config.ResourceLocator;
import com.rulesdsl.exception.ConfigurationException;

/**
 * Model parameters and system prompt of the rule builder.
 */
public record RuleBuilderSettings(String systemPrompt, int maxTokens, double temperature) {

    public static final String DEFAULT_PROMPT_PATH = "classpath:prompts/rule-builder-system.txt";
    public static final int DEFAULT_MAX_TOKENS = 2000;
    public static final double DEFAULT_TEMPERATURE = 0.3;

    public RuleBuilderSettings {
        if (maxTokens <= 0) {
            throw new ConfigurationException("maxTokens must be positive: " + maxTokens);
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new ConfigurationException("temperature must be within [0, 2]: " + temperature);
        }
    }

    /**
     * Load the prompt from a path (classpath: prefix supported).
     */
    public static RuleBuilderSettings load(String promptPath, int maxTokens, double temperature) {
        return new RuleBuilderSettings(ResourceLocator.readString(promptPath).strip(), maxTokens, temperature);
    }

    public static RuleBuilderSettings defaults() {
        return load(DEFAULT_PROMPT_PATH, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE);
    }
}
