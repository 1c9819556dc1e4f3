package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Entity a rule is attached to.
 */
public enum RuleType {
    PRODUCT("Product"),
    COVERAGE("Coverage"),
    FORMS("Forms"),
    PRICING("Pricing");

    private final String wireName;

    RuleType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RuleType fromWireName(String name) {
        for (RuleType value : values()) {
            if (value.wireName.equalsIgnoreCase(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown rule type: " + name);
    }
}
