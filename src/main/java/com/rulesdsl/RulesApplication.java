package com.rulesdsl;

import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.core.EvaluationContextFactory;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.ActionOperator;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.MessageSeverity;
import com.rulesdsl.dsl.RuleCategory;
import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.engine.RuleSetEvaluator;
import com.rulesdsl.engine.RuleSetResult;
import com.rulesdsl.spring.EnableRules;
import com.rulesdsl.store.RuleStore;
import com.rulesdsl.template.RuleTemplateCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application demonstrating rule evaluation.
 */
@SpringBootApplication
@EnableRules
public class RulesApplication {

    private static final Logger log = LoggerFactory.getLogger(RulesApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RulesApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(RuleStore store, RuleSetEvaluator evaluator, RuleTemplateCatalog catalog) {
        return args -> {
            log.info("=== Rules Demo Started ===");
            log.info("Loaded {} templates in categories {}", catalog.size(), catalog.categories());

            String productId = "commercial-property";

            store.saveRule(productId, RuleDraft.of("Restricted States", RuleCategory.ELIGIBILITY,
                    RuleLogic.of(
                            ConditionGroup.and(Condition.in("risk.state", List.of("FL", "LA"))),
                            List.of(Action.block("coverage", "Coverage is not available in this state")))));

            store.saveRule(productId, RuleDraft.of("Large Building Surcharge", RuleCategory.PRICING,
                    RuleLogic.of(
                            ConditionGroup.and(Condition.greaterThan("risk.squareFootage", 50000)),
                            List.of(Action.set("pricing.basePremium", ActionOperator.MULTIPLY, 1.1),
                                    Action.addMessage("Large building surcharge applied", MessageSeverity.INFO)))));

            EvaluationContext context = EvaluationContextFactory.fromJson("demo-quote", """
                    {
                        "risk": {"state": "TX", "squareFootage": 75000},
                        "pricing": {"basePremium": 12000}
                    }
                    """);

            RuleSetResult result = evaluator.evaluate(productId, context);
            result.outcomes().forEach(outcome -> log.info("Rule '{}': matched={}, delta={}",
                    outcome.ruleName(), outcome.result().isMatched(), outcome.result().getContextDelta()));
            log.info("Blocked: {}, messages: {}", result.blocked(), result.messages());

            log.info("=== Rules Demo Completed ===");
        };
    }
}
