package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Operator combining the children of a condition group.
 */
public enum LogicalOperator {
    AND,
    OR;

    @JsonCreator
    public static LogicalOperator fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Logical operator cannot be null");
        }
        return valueOf(name.toUpperCase());
    }
}
