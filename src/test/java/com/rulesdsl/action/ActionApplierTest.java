package com.rulesdsl.action;

import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.core.EvaluationContextFactory;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.ActionOperator;
import com.rulesdsl.dsl.ActionType;
import com.rulesdsl.dsl.ActionValue;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.MessageSeverity;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.variable.DefaultFieldPathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ActionApplier.
 */
class ActionApplierTest {

    private static final ConditionGroup ANY = ConditionGroup.and(Condition.exists("risk.state"));

    private ActionApplier applier;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        applier = new ActionApplier(new DefaultFieldPathResolver());
        context = EvaluationContextFactory.fromJson("""
                {"pricing": {"basePremium": 1000, "factor": 1.5}, "risk": {"state": "CA"}}
                """);
    }

    // =====================================================================
    // Branch selection
    // =====================================================================

    @Test
    @DisplayName("Block with a message yields blocked and an error message")
    void blockProducesErrorMessage() {
        RuleLogic logic = RuleLogic.of(ANY, List.of(Action.block(null, "Declined")));

        ActionOutcome outcome = applier.selectAndApply(logic, true);

        assertTrue(outcome.blocked());
        assertEquals(List.of(new RuleMessage("Declined", MessageSeverity.ERROR)), outcome.messages());
        assertEquals(logic.thenActions(), outcome.actions());
    }

    @Test
    @DisplayName("Unmatched rule without else selects nothing")
    void unmatchedWithoutElse() {
        RuleLogic logic = RuleLogic.of(ANY, List.of(Action.block("coverage", "Declined")));

        ActionOutcome outcome = applier.selectAndApply(logic, false);

        assertFalse(outcome.blocked());
        assertTrue(outcome.actions().isEmpty());
        assertTrue(outcome.messages().isEmpty());
        assertTrue(outcome.contextDelta().isEmpty());
    }

    @Test
    @DisplayName("Unmatched rule selects the else branch")
    void unmatchedSelectsElse() {
        Action accept = Action.addMessage("Accepted", MessageSeverity.SUCCESS);
        RuleLogic logic = RuleLogic.of(ANY, List.of(Action.block("coverage", "Declined")), List.of(accept));

        ActionOutcome outcome = applier.selectAndApply(logic, false);

        assertFalse(outcome.blocked());
        assertEquals(List.of(accept), outcome.actions());
        assertEquals(List.of(new RuleMessage("Accepted", MessageSeverity.SUCCESS)), outcome.messages());
    }

    // =====================================================================
    // Messages
    // =====================================================================

    @Test
    @DisplayName("addMessage without a severity defaults to info")
    void messageDefaultsToInfo() {
        Action action = new Action(ActionType.ADD_MESSAGE, "messages", null, null, "Review", null, null);
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(action)), true);

        assertEquals(List.of(RuleMessage.info("Review")), outcome.messages());
    }

    @Test
    @DisplayName("Messages keep declaration order and blocks without a message add none")
    void messageOrder() {
        RuleLogic logic = RuleLogic.of(ANY, List.of(
                Action.addMessage("first", MessageSeverity.WARNING),
                Action.block("coverage", null),
                Action.addMessage("second", MessageSeverity.INFO)));

        ActionOutcome outcome = applier.selectAndApply(logic, true);

        assertTrue(outcome.blocked());
        assertEquals(List.of("first", "second"), outcome.messages().stream().map(RuleMessage::message).toList());
    }

    @Test
    @DisplayName("Other action types are reported but not interpreted")
    void otherActionsAreReported() {
        Action attach = Action.of(ActionType.ATTACH_FORM, "forms", "CP 00 10");
        Action factor = Action.of(ActionType.APPLY_FACTOR, "pricing.territoryFactor", 1.15);
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(attach, factor)), true, context);

        assertEquals(List.of(attach, factor), outcome.actions());
        assertTrue(outcome.messages().isEmpty());
        assertFalse(outcome.blocked());
        assertTrue(outcome.contextDelta().isEmpty());
    }

    // =====================================================================
    // Context delta
    // =====================================================================

    @Test
    @DisplayName("set records the value under its context path")
    void setRecordsValue() {
        ActionOutcome outcome = applier.selectAndApply(
                RuleLogic.of(ANY, List.of(Action.set("risk.tier", "preferred"))), true, context);

        assertEquals(Map.of("risk", Map.of("tier", "preferred")), outcome.contextDelta());
    }

    @Test
    @DisplayName("Arithmetic set combines with the current context value")
    void setArithmetic() {
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(
                Action.set("pricing.basePremium", ActionOperator.MULTIPLY, 1.1))), true, context);

        assertEquals(Map.of("pricing", Map.of("basePremium", 1100L)), outcome.contextDelta());
    }

    @Test
    @DisplayName("Chained arithmetic reads earlier delta entries first")
    void setArithmeticChained() {
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(
                Action.set("pricing.basePremium", ActionOperator.ADD, 500),
                Action.set("pricing.basePremium", ActionOperator.DIVIDE, 2),
                Action.set("pricing.factor", ActionOperator.SUBTRACT, 0.25))), true, context);

        assertEquals(Map.of("pricing", Map.of("basePremium", 750L, "factor", 1.25)), outcome.contextDelta());
    }

    @Test
    @DisplayName("Arithmetic without a numeric current value or with division by zero records nothing")
    void setArithmeticSkipped() {
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(
                Action.set("pricing.missing", ActionOperator.ADD, 1),
                Action.set("risk.state", ActionOperator.MULTIPLY, 2),
                Action.set("pricing.basePremium", ActionOperator.DIVIDE, 0))), true, context);

        assertTrue(outcome.contextDelta().isEmpty());
    }

    @Test
    @DisplayName("Arithmetic without a context records nothing")
    void setArithmeticWithoutContext() {
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(
                Action.set("pricing.basePremium", ActionOperator.ADD, 1))), true);

        assertTrue(outcome.contextDelta().isEmpty());
    }

    @Test
    @DisplayName("Context delta keeps the order in which sections were first set")
    void setDeltaOrder() {
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(
                Action.set("pricing.tier", "A"),
                Action.set("risk.tier", "preferred"),
                Action.set("coverage.limit", 500000),
                Action.set("policy.term", 12))), true, context);

        assertEquals(List.of("pricing", "risk", "coverage", "policy"), List.copyOf(outcome.contextDelta().keySet()));
    }

    @Test
    @DisplayName("set targets outside the context sections record nothing")
    void setNonContextTarget() {
        Action action = new Action(ActionType.SET, "premium", ActionOperator.EQUALS,
                ActionValue.ofNumber(5), null, null, null);
        ActionOutcome outcome = applier.selectAndApply(RuleLogic.of(ANY, List.of(action)), true, context);

        assertEquals(List.of(action), outcome.actions());
        assertTrue(outcome.contextDelta().isEmpty());
    }

    @Test
    @DisplayName("Context delta is unmodifiable")
    void deltaIsUnmodifiable() {
        ActionOutcome outcome = applier.selectAndApply(
                RuleLogic.of(ANY, List.of(Action.set("risk.tier", "preferred"))), true, context);

        assertThrows(UnsupportedOperationException.class, () -> outcome.contextDelta().put("x", 1));
    }
}
