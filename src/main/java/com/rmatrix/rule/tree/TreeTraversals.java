package com.rmatrix.rule.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first renderings of an expression tree, used for diagnostic traces.
 */
public final class TreeTraversals {

    private TreeTraversals() {
    }

    /** Left, node, right. */
    public static String inOrder(ExpressionNode root) {
        List<String> labels = new ArrayList<>();
        inOrder(root, labels);
        return String.join(" ", labels);
    }

    /** Node, left, right. */
    public static String preOrder(ExpressionNode root) {
        List<String> labels = new ArrayList<>();
        preOrder(root, labels);
        return String.join(" ", labels);
    }

    /** Left, right, node. */
    public static String postOrder(ExpressionNode root) {
        List<String> labels = new ArrayList<>();
        postOrder(root, labels);
        return String.join(" ", labels);
    }

    private static void inOrder(ExpressionNode node, List<String> labels) {
        if (node == null) {
            return;
        }
        inOrder(left(node), labels);
        labels.add(node.label());
        inOrder(right(node), labels);
    }

    private static void preOrder(ExpressionNode node, List<String> labels) {
        if (node == null) {
            return;
        }
        labels.add(node.label());
        preOrder(left(node), labels);
        preOrder(right(node), labels);
    }

    private static void postOrder(ExpressionNode node, List<String> labels) {
        if (node == null) {
            return;
        }
        postOrder(left(node), labels);
        postOrder(right(node), labels);
        labels.add(node.label());
    }

    private static ExpressionNode left(ExpressionNode node) {
        return node instanceof OperatorNode op ? op.left() : null;
    }

    private static ExpressionNode right(ExpressionNode node) {
        return node instanceof OperatorNode op ? op.right() : null;
    }
}
