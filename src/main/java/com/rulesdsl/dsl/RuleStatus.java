package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a stored rule.
 */
public enum RuleStatus {
    ACTIVE("Active"),
    INACTIVE("Inactive"),
    DRAFT("Draft"),
    UNDER_REVIEW("Under Review"),
    ARCHIVED("Archived");

    private final String wireName;

    RuleStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RuleStatus fromWireName(String name) {
        for (RuleStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown rule status: " + name);
    }
}
