package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The programmable IF/THEN/ELSE structure of a rule.
 *
 * @param version      Schema version
 * @param condition    IF: the root condition group
 * @param thenActions  THEN: actions reported when the condition matches
 * @param elseActions  ELSE: actions reported when it does not (may be null)
 */
public record RuleLogic(
        @JsonProperty("version") int version,
        @JsonProperty("if") ConditionGroup condition,
        @JsonProperty("then") List<Action> thenActions,
        @JsonProperty("else") List<Action> elseActions
) {

    public static final int CURRENT_VERSION = 1;

    public RuleLogic {
        Objects.requireNonNull(condition, "Rule logic requires an 'if' group");
        thenActions = thenActions == null ? List.of() : List.copyOf(thenActions);
        elseActions = elseActions == null ? null : List.copyOf(elseActions);
    }

    public static RuleLogic of(ConditionGroup condition, List<Action> thenActions) {
        return new RuleLogic(CURRENT_VERSION, condition, thenActions, null);
    }

    public static RuleLogic of(ConditionGroup condition, List<Action> thenActions, List<Action> elseActions) {
        return new RuleLogic(CURRENT_VERSION, condition, thenActions, elseActions);
    }
}
