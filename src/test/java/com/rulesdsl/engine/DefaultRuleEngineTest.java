package com.rulesdsl.engine;

import com.rulesdsl.action.RuleMessage;
import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.core.EvaluationContextFactory;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.ActionOperator;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.ConditionOperator;
import com.rulesdsl.dsl.MessageSeverity;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.dsl.json.RuleLogicCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultRuleEngine, driven through the JSON wire format.
 */
class DefaultRuleEngineTest {

    private static final String STATE_AND_TIV = """
            {
              "version": 1,
              "if": {
                "op": "AND",
                "conditions": [
                  {"field": "risk.state", "operator": "equals", "value": "CA", "valueType": "string"},
                  {"field": "risk.tiv", "operator": "gt", "value": 1000000, "valueType": "number"}
                ]
              },
              "then": [{"type": "addMessage", "target": "messages", "message": "High value CA risk", "severity": "warning"}]
            }
            """;

    private RuleEngine engine;
    private RuleLogicCodec codec;

    @BeforeEach
    void setUp() {
        engine = new DefaultRuleEngine();
        codec = new RuleLogicCodec();
    }

    // =====================================================================
    // Scenarios
    // =====================================================================

    @Test
    @DisplayName("AND group matches when state and TIV both satisfy")
    void andGroupMatches() {
        EvaluationResult result = engine.evaluate(codec.read(STATE_AND_TIV),
                EvaluationContextFactory.fromJson("{\"risk\": {\"state\": \"CA\", \"tiv\": 2000000}}"));

        assertTrue(result.isMatched());
        assertEquals(2, result.getConditionResults().size());
        assertEquals(List.of(new RuleMessage("High value CA risk", MessageSeverity.WARNING)), result.getMessages());
    }

    @Test
    @DisplayName("AND group fails on the second condition and reports both results")
    void andGroupFailsOnSecond() {
        EvaluationResult result = engine.evaluate(codec.read(STATE_AND_TIV),
                EvaluationContextFactory.fromJson("{\"risk\": {\"state\": \"CA\", \"tiv\": 500000}}"));

        assertFalse(result.isMatched());
        assertEquals(2, result.getConditionResults().size());
        assertTrue(result.getConditionResults().get(0).matched());
        assertFalse(result.getConditionResults().get(1).matched());
        assertTrue(result.getApplicableActions().isEmpty());
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    @DisplayName("between matches inside the range and not above it")
    void betweenScenario() {
        RuleLogic logic = codec.read("""
                {"if": {"op": "AND", "conditions": [
                  {"field": "coverage.limit", "operator": "between", "value": [100000, 500000]}
                ]}, "then": [{"type": "setLimit", "target": "coverage.limit", "value": 500000}]}
                """);

        assertTrue(engine.evaluate(logic,
                EvaluationContextFactory.fromJson("{\"coverage\": {\"limit\": 300000}}")).isMatched());
        assertFalse(engine.evaluate(logic,
                EvaluationContextFactory.fromJson("{\"coverage\": {\"limit\": 600000}}")).isMatched());
    }

    @Test
    @DisplayName("Matched block yields blocked with an error message")
    void blockScenario() {
        RuleLogic logic = codec.read("""
                {"if": {"op": "AND", "conditions": [{"field": "risk.state", "operator": "exists"}]},
                 "then": [{"type": "block", "message": "Declined"}]}
                """);

        EvaluationResult result = engine.evaluate(logic,
                EvaluationContextFactory.fromJson("{\"risk\": {\"state\": \"FL\"}}"));

        assertTrue(result.isBlocked());
        assertEquals(List.of(new RuleMessage("Declined", MessageSeverity.ERROR)), result.getMessages());
    }

    @Test
    @DisplayName("An invalid regex does not match and does not throw")
    void invalidRegexScenario() {
        RuleLogic logic = RuleLogic.of(
                ConditionGroup.and(Condition.of("insured.name", ConditionOperator.MATCHES, "(unclosed")),
                List.of(Action.block("coverage", "Matched")));
        EvaluationContext context = EvaluationContextFactory.fromJson("{\"insured\": {\"name\": \"Acme (unclosed\"}}");

        EvaluationResult result = assertDoesNotThrow(() -> engine.evaluate(logic, context));

        assertFalse(result.isMatched());
        assertFalse(result.isBlocked());
    }

    // =====================================================================
    // Properties
    // =====================================================================

    @Test
    @DisplayName("Evaluating the same rule and context twice gives equal results")
    void deterministic() {
        RuleLogic logic = codec.read(STATE_AND_TIV);
        EvaluationContext context = EvaluationContextFactory.fromJson(
                "{\"risk\": {\"state\": \"CA\", \"tiv\": 2000000}}");

        assertEquals(engine.evaluate(logic, context), engine.evaluate(logic, context));
    }

    @Test
    @DisplayName("Evaluation leaves the rule and the context unchanged")
    void noMutation() {
        RuleLogic logic = RuleLogic.of(
                ConditionGroup.and(Condition.exists("pricing.basePremium")),
                List.of(Action.set("pricing.basePremium", ActionOperator.MULTIPLY, 2)));
        String before = codec.write(logic);
        EvaluationContext context = EvaluationContextFactory.fromJson("{\"pricing\": {\"basePremium\": 100}}");

        EvaluationResult result = engine.evaluate(logic, context);

        assertEquals(Map.of("pricing", Map.of("basePremium", 200L)), result.getContextDelta());
        assertEquals(before, codec.write(logic));
        assertEquals(Map.of("pricing", Map.of("basePremium", 100)), context.asMap());
    }

    @Test
    @DisplayName("Else branch is applied when the group does not match")
    void elseBranch() {
        RuleLogic logic = RuleLogic.of(
                ConditionGroup.and(Condition.in("risk.state", List.of("CA", "NY"))),
                List.of(Action.block("coverage", "Not available")),
                List.of(Action.addMessage("Available", MessageSeverity.SUCCESS)));

        EvaluationResult result = engine.evaluate(logic,
                EvaluationContextFactory.fromJson("{\"risk\": {\"state\": \"TX\"}}"));

        assertFalse(result.isMatched());
        assertFalse(result.isBlocked());
        assertEquals(List.of(new RuleMessage("Available", MessageSeverity.SUCCESS)), result.getMessages());
    }

    @Test
    @DisplayName("A null context is treated as empty")
    void nullContext() {
        EvaluationResult result = engine.evaluate(codec.read(STATE_AND_TIV), null);

        assertFalse(result.isMatched());
        assertNull(result.getConditionResults().get(0).actualValue());
    }
}
