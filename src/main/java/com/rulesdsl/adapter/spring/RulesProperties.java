package com.rulesdsl.adapter.spring;

import com.rulesdsl.builder.RuleBuilderSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the rules engine.
 */
@ConfigurationProperties(prefix = "rules")
public class RulesProperties {

    /**
     * Whether the rules engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the rule templates file.
     * Supports classpath: prefix for classpath resources.
     */
    private String templatesPath = "classpath:rule-templates.yaml";

    /**
     * Worker threads used to evaluate a product's rule set.
     */
    private int evaluatorThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    private final Builder builder = new Builder();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTemplatesPath() {
        return templatesPath;
    }

    public void setTemplatesPath(String templatesPath) {
        this.templatesPath = templatesPath;
    }

    public int getEvaluatorThreads() {
        return evaluatorThreads;
    }

    public void setEvaluatorThreads(int evaluatorThreads) {
        this.evaluatorThreads = evaluatorThreads;
    }

    public Builder getBuilder() {
        return builder;
    }

    /**
     * Rule builder settings.
     */
    public static class Builder {

        private String systemPromptPath = RuleBuilderSettings.DEFAULT_PROMPT_PATH;

        private int maxTokens = RuleBuilderSettings.DEFAULT_MAX_TOKENS;

        private double temperature = RuleBuilderSettings.DEFAULT_TEMPERATURE;

        public String getSystemPromptPath() {
            return systemPromptPath;
        }

        public void setSystemPromptPath(String systemPromptPath) {
            this.systemPromptPath = systemPromptPath;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }
}
