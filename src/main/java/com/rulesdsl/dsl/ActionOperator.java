package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an action value is combined with the current target value.
 */
public enum ActionOperator {
    EQUALS("equals"),
    ADD("add"),
    SUBTRACT("subtract"),
    MULTIPLY("multiply"),
    DIVIDE("divide");

    private final String wireName;

    ActionOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isArithmetic() {
        return this != EQUALS;
    }

    @JsonCreator
    public static ActionOperator fromWireName(String name) {
        for (ActionOperator operator : values()) {
            if (operator.wireName.equals(name)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown action operator: " + name);
    }
}
