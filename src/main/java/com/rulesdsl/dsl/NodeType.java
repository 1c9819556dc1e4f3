package com.rulesdsl.dsl;

/**
 * Discriminator for the two kinds of node in a condition tree.
 */
public enum NodeType {
    /** A single field/operator/value comparison. */
    LEAF,
    /** An AND/OR combination of child nodes. */
    GROUP
}
