package com.rmatrix.rule.tree;

/**
 * Node kinds of a rule expression tree.
 */
public enum NodeType {
    // Logical
    AND,
    OR,
    NOT,

    // Leaf
    OPERAND
}
