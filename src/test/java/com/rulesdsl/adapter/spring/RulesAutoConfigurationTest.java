package com.rulesdsl.adapter.spring;

import com.rulesdsl.builder.RuleBuilderRequest;
import com.rulesdsl.builder.RuleBuilderResponse;
import com.rulesdsl.builder.RuleBuilderService;
import com.rulesdsl.core.EvaluationContextFactory;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.RuleCategory;
import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.engine.RuleEngine;
import com.rulesdsl.engine.RuleSetEvaluator;
import com.rulesdsl.engine.RuleSetResult;
import com.rulesdsl.store.RuleStore;
import com.rulesdsl.template.RuleTemplateCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RulesAutoConfiguration wiring.
 */
class RulesAutoConfigurationTest {

    @Test
    @DisplayName("Should wire the engine, store, catalog, builder and rule-set evaluator")
    void wiresBeans() {
        try (AnnotationConfigApplicationContext ctx = create(Map.of("rules.evaluator-threads", "2"))) {
            assertNotNull(ctx.getBean(RuleEngine.class));
            assertEquals(20, ctx.getBean(RuleTemplateCatalog.class).size());
            assertEquals(2, ctx.getBean(RulesProperties.class).getEvaluatorThreads());

            RuleStore store = ctx.getBean(RuleStore.class);
            store.saveRule("bop", RuleDraft.of("Coastal", RuleCategory.ELIGIBILITY, RuleLogic.of(
                    ConditionGroup.and(Condition.in("location.state", List.of("FL"))),
                    List.of(Action.block("coverage", "Declined")))));

            RuleSetResult result = ctx.getBean(RuleSetEvaluator.class)
                    .evaluate("bop", EvaluationContextFactory.fromJson("{\"location\": {\"state\": \"FL\"}}"));
            assertTrue(result.blocked());
        }
    }

    @Test
    @DisplayName("Without a model client bean, generation fails gracefully")
    void unconfiguredClient() {
        try (AnnotationConfigApplicationContext ctx = create(Map.of())) {
            RuleBuilderResponse response = ctx.getBean(RuleBuilderService.class)
                    .generate(RuleBuilderRequest.of("Decline FL", "bop"));

            assertFalse(response.success());
            assertEquals("No RuleGenerationClient configured", response.error());
        }
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void disabled() {
        try (AnnotationConfigApplicationContext ctx = create(Map.of("rules.enabled", "false"))) {
            assertTrue(ctx.getBeansOfType(RuleEngine.class).isEmpty());
        }
    }

    private static AnnotationConfigApplicationContext create(Map<String, Object> properties) {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        ctx.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
        ctx.register(RulesAutoConfiguration.class);
        ctx.refresh();
        return ctx;
    }
}
