package com.rmatrix.rule.tree;

import java.util.Objects;

/**
 * Leaf node naming a gene, metabolite or regulator, possibly pre-negated.
 *
 * @param name Operand name
 */
public record OperandNode(String name) implements ExpressionNode {

    public OperandNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public NodeType type() {
        return NodeType.OPERAND;
    }

    @Override
    public String label() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
