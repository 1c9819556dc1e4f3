package com.rulesdsl.adapter.spring;

import com.rulesdsl.builder.RuleBuilderService;
import com.rulesdsl.builder.RuleBuilderSettings;
import com.rulesdsl.builder.RuleGenerationClient;
import com.rulesdsl.builder.UnconfiguredRuleGenerationClient;
import com.rulesdsl.dsl.json.RuleLogicCodec;
import com.rulesdsl.engine.DefaultRuleEngine;
import com.rulesdsl.engine.RuleEngine;
import com.rulesdsl.engine.RuleSetEvaluator;
import com.rulesdsl.store.InMemoryRuleStore;
import com.rulesdsl.store.RuleStore;
import com.rulesdsl.template.RuleTemplateCatalog;
import com.rulesdsl.template.TemplateLoader;
import com.rulesdsl.validation.RuleDraftValidator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for the rules engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "rules", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RulesProperties.class)
public class RulesAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RulesAutoConfiguration.class);

    private RuleSetEvaluator ruleSetEvaluator;

    @Bean
    @ConditionalOnMissingBean
    public RuleLogicCodec ruleLogicCodec() {
        return new RuleLogicCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEngine ruleEngine() {
        return new DefaultRuleEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleDraftValidator ruleDraftValidator() {
        return new RuleDraftValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleStore ruleStore(RuleLogicCodec codec) {
        return new InMemoryRuleStore(codec, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleTemplateCatalog ruleTemplateCatalog(RulesProperties properties, RuleLogicCodec codec) {
        return new RuleTemplateCatalog(TemplateLoader.load(properties.getTemplatesPath(), codec));
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleGenerationClient ruleGenerationClient() {
        log.warn("No RuleGenerationClient bean defined, rule generation requests will fail");
        return new UnconfiguredRuleGenerationClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleBuilderService ruleBuilderService(RuleGenerationClient client, RulesProperties properties,
                                                 RuleLogicCodec codec, RuleDraftValidator validator) {
        RulesProperties.Builder builder = properties.getBuilder();
        log.info("Loading rule builder prompt from: {}", builder.getSystemPromptPath());
        RuleBuilderSettings settings = RuleBuilderSettings.load(
                builder.getSystemPromptPath(), builder.getMaxTokens(), builder.getTemperature());
        return new RuleBuilderService(client, settings, codec, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleSetEvaluator ruleSetEvaluator(RuleEngine engine, RuleStore store, RulesProperties properties) {
        log.info("Creating RuleSetEvaluator with {} threads", properties.getEvaluatorThreads());
        this.ruleSetEvaluator = new RuleSetEvaluator(engine, store, properties.getEvaluatorThreads());
        return this.ruleSetEvaluator;
    }

    @PreDestroy
    public void shutdown() {
        if (ruleSetEvaluator != null) {
            ruleSetEvaluator.shutdown();
        }
    }
}
