package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type hint attached to a condition value. Informational only; evaluation
 * always inspects the runtime types of both operands.
 */
public enum ConditionValueType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    DATE("date");

    private final String wireName;

    ConditionValueType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ConditionValueType fromWireName(String name) {
        for (ConditionValueType type : values()) {
            if (type.wireName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type: " + name);
    }
}
