package com.rulesdsl.dsl;

/**
 * A node of a rule's condition tree: either a {@link Condition} leaf
 * or a nested {@link ConditionGroup}.
 */
public interface ConditionNode {

    /**
     * Get the node type, used to dispatch between leaves and groups.
     */
    NodeType nodeType();
}
