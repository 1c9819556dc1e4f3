package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A group of conditions or nested groups combined with AND/OR.
 *
 * @param op         Logical operator
 * @param conditions Child nodes, evaluated in declaration order
 */
public record ConditionGroup(
        LogicalOperator op,
        List<ConditionNode> conditions
) implements ConditionNode {

    public ConditionGroup {
        Objects.requireNonNull(op, "Condition group requires an op");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @Override
    @JsonIgnore
    public NodeType nodeType() {
        return NodeType.GROUP;
    }

    /**
     * Check if the group has no children.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public static ConditionGroup and(ConditionNode... conditions) {
        return new ConditionGroup(LogicalOperator.AND, Arrays.asList(conditions));
    }

    public static ConditionGroup or(ConditionNode... conditions) {
        return new ConditionGroup(LogicalOperator.OR, Arrays.asList(conditions));
    }

    @Override
    public String toString() {
        return op + " " + conditions;
    }
}
