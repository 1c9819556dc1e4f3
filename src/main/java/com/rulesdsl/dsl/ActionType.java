package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of action a rule can report.
 */
public enum ActionType {
    // Value changes
    SET("set"),
    ADD("add"),
    REMOVE("remove"),

    // Eligibility
    BLOCK("block"),
    REQUIRE("require"),

    // Pricing
    APPLY_FACTOR("applyFactor"),

    // Forms
    ATTACH_FORM("attachForm"),
    DETACH_FORM("detachForm"),

    // Messaging
    ADD_MESSAGE("addMessage"),

    // Coverage
    SET_COVERAGE("setCoverage"),
    SET_LIMIT("setLimit"),
    SET_DEDUCTIBLE("setDeductible"),

    // Extension point
    CUSTOM("custom");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Whether this action carries a user-facing message rather than a target.
     */
    public boolean isMessaging() {
        return this == ADD_MESSAGE || this == BLOCK;
    }

    @JsonCreator
    public static ActionType fromWireName(String name) {
        for (ActionType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + name);
    }
}
