package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators supported by a rule condition.
 * Each constant carries the name used in the JSON wire format.
 */
public enum ConditionOperator {
    // Equality
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),

    // Membership
    IN("in"),
    NOT_IN("notIn"),

    // Numeric
    GREATER_THAN("gt"),
    GREATER_THAN_OR_EQUALS("gte"),
    LESS_THAN("lt"),
    LESS_THAN_OR_EQUALS("lte"),
    BETWEEN("between"),

    // Containment
    CONTAINS("contains"),
    NOT_CONTAINS("notContains"),

    // Existence
    EXISTS("exists"),
    NOT_EXISTS("notExists"),

    // String
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    MATCHES("matches");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Whether a condition using this operator must carry an expected value.
     */
    public boolean requiresValue() {
        return this != EXISTS && this != NOT_EXISTS;
    }

    /**
     * Look up an operator by its wire name (e.g. "gte", "notIn").
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static ConditionOperator fromWireName(String name) {
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equals(name)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + name);
    }
}
