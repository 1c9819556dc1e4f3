package com.rulesdsl.builder;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a chat message.
 */
public enum ChatRole {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    ChatRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
