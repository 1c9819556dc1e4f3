package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a rule message.
 */
public enum MessageSeverity {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    SUCCESS("success");

    private final String wireName;

    MessageSeverity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static MessageSeverity fromWireName(String name) {
        for (MessageSeverity severity : values()) {
            if (severity.wireName.equalsIgnoreCase(name)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown message severity: " + name);
    }
}
