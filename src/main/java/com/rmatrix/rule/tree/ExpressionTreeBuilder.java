package com.rmatrix.rule.tree;

import com.rmatrix.exception.StructuralParseException;
import com.rmatrix.rule.expression.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds an expression tree from a prefix token stream.
 * <p>
 * The stream is consumed from its last token to its first with a value
 * stack. Operands are pushed as leaves; AND and OR pop their left child and
 * then their right child; NOT pops its only child. Exactly one node, the
 * root, must remain.
 */
public final class ExpressionTreeBuilder {

    private final List<Token> prefix;

    public ExpressionTreeBuilder(List<Token> prefix) {
        this.prefix = prefix;
    }

    /**
     * Build the tree.
     *
     * @return Root node
     * @throws StructuralParseException on stack underflow, an empty stream or several roots
     */
    public ExpressionNode build() {
        if (prefix == null || prefix.isEmpty()) {
            throw new StructuralParseException("Prefix expression is empty");
        }

        Deque<ExpressionNode> stack = new ArrayDeque<>();
        for (int i = prefix.size() - 1; i >= 0; i--) {
            Token token = prefix.get(i);
            switch (token.type()) {
                case AND -> stack.push(OperatorNode.and(pop(stack, token), pop(stack, token)));
                case OR -> stack.push(OperatorNode.or(pop(stack, token), pop(stack, token)));
                case NOT -> stack.push(OperatorNode.not(pop(stack, token)));
                case OPERAND -> stack.push(new OperandNode(token.text()));
                default -> throw new StructuralParseException("Unexpected token " + token
                        + " in prefix expression '" + render() + "'");
            }
        }

        if (stack.size() != 1) {
            throw new StructuralParseException("Prefix expression '" + render() + "' leaves "
                    + stack.size() + " roots, expected 1");
        }
        return stack.pop();
    }

    private ExpressionNode pop(Deque<ExpressionNode> stack, Token operator) {
        if (stack.isEmpty()) {
            throw new StructuralParseException("Operator " + operator.text() + " at token "
                    + operator.position() + " is missing an operand in prefix expression '" + render() + "'");
        }
        return stack.pop();
    }

    private String render() {
        return prefix.stream().map(Token::text).collect(Collectors.joining(" "));
    }
}
