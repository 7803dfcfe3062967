package com.rmatrix.rule.tree;

/**
 * A node of a rule expression tree.
 * Trees are immutable and strictly tree shaped: every node has one parent,
 * except the root.
 */
public interface ExpressionNode {

    /**
     * Get the node kind.
     *
     * @return Node type
     */
    NodeType type();

    /**
     * Text of the node: the operand name or the operator keyword.
     */
    String label();
}
