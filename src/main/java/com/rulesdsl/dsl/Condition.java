package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A single comparison between a context field and an expected value.
 *
 * @param field       Dotted field path (e.g. "risk.classCode", "coverage.building.limit")
 * @param operator    Comparison operator
 * @param value       Expected value; absent for EXISTS/NOT_EXISTS, a 2-element list for BETWEEN
 * @param valueType   Optional type hint
 * @param description Optional human-readable description
 */
public record Condition(
        String field,
        ConditionOperator operator,
        Object value,
        ConditionValueType valueType,
        String description
) implements ConditionNode {

    @Override
    @JsonIgnore
    public NodeType nodeType() {
        return NodeType.LEAF;
    }

    public static Condition of(String field, ConditionOperator operator, Object value) {
        return new Condition(field, operator, value, null, null);
    }

    public static Condition equalTo(String field, Object value) {
        return of(field, ConditionOperator.EQUALS, value);
    }

    public static Condition in(String field, List<?> values) {
        return of(field, ConditionOperator.IN, values);
    }

    public static Condition greaterThan(String field, Number threshold) {
        return of(field, ConditionOperator.GREATER_THAN, threshold);
    }

    public static Condition between(String field, Number low, Number high) {
        return of(field, ConditionOperator.BETWEEN, List.of(low, high));
    }

    public static Condition exists(String field) {
        return of(field, ConditionOperator.EXISTS, null);
    }

    @Override
    public String toString() {
        return value == null && operator != null && !operator.requiresValue()
                ? field + " " + operator.getWireName()
                : field + " " + (operator != null ? operator.getWireName() : "?") + " " + value;
    }
}
