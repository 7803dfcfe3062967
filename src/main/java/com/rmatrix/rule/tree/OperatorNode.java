package com.rmatrix.rule.tree;

/**
 * Logical operator node.
 * AND and OR own a left and a right child; NOT owns a single child stored as left.
 * Children are not checked here; a missing child is reported at evaluation time.
 *
 * @param type  AND, OR or NOT
 * @param left  Left (or only) child
 * @param right Right child, null for NOT
 */
public record OperatorNode(NodeType type, ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    public OperatorNode {
        if (type == null || type == NodeType.OPERAND) {
            throw new IllegalArgumentException("Operator node requires AND, OR or NOT, got " + type);
        }
    }

    public static OperatorNode and(ExpressionNode left, ExpressionNode right) {
        return new OperatorNode(NodeType.AND, left, right);
    }

    public static OperatorNode or(ExpressionNode left, ExpressionNode right) {
        return new OperatorNode(NodeType.OR, left, right);
    }

    public static OperatorNode not(ExpressionNode child) {
        return new OperatorNode(NodeType.NOT, child, null);
    }

    @Override
    public String label() {
        return type.name();
    }

    @Override
    public String toString() {
        if (type == NodeType.NOT) {
            return "NOT(" + left + ")";
        }
        return type + "(" + left + ", " + right + ")";
    }
}
