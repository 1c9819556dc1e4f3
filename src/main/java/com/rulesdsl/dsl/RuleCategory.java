package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Business category of a rule.
 */
public enum RuleCategory {
    ELIGIBILITY("Eligibility"),
    PRICING("Pricing"),
    COMPLIANCE("Compliance"),
    COVERAGE("Coverage"),
    FORMS("Forms");

    private final String wireName;

    RuleCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RuleCategory fromWireName(String name) {
        for (RuleCategory value : values()) {
            if (value.wireName.equalsIgnoreCase(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown rule category: " + name);
    }
}
