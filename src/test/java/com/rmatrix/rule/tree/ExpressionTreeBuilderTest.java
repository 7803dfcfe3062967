package com.rmatrix.rule.tree;

import com.rmatrix.exception.StructuralParseException;
import com.rmatrix.rule.expression.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionTreeBuilder and TreeTraversals.
 */
class ExpressionTreeBuilderTest {

    private static List<Token> prefix(String text) {
        List<Token> tokens = new ArrayList<>();
        String[] parts = text.split(" ");
        for (int i = 0; i < parts.length; i++) {
            tokens.add(Token.of(parts[i], i));
        }
        return tokens;
    }

    private static ExpressionNode build(String text) {
        return new ExpressionTreeBuilder(prefix(text)).build();
    }

    private static OperandNode op(String name) {
        return new OperandNode(name);
    }

    @Test
    @DisplayName("Should build binary operators with left then right child")
    void shouldBuildBinaryOperators() {
        ExpressionNode root = build("OR AND A B C");

        assertEquals(OperatorNode.or(OperatorNode.and(op("A"), op("B")), op("C")), root);
        assertEquals(NodeType.OR, root.type());
    }

    @Test
    @DisplayName("Should build NOT with a single left child")
    void shouldBuildNot() {
        ExpressionNode root = build("NOT OR ArcA Fnr");

        OperatorNode not = assertInstanceOf(OperatorNode.class, root);
        assertEquals(NodeType.NOT, not.type());
        assertNull(not.right());
        assertEquals(OperatorNode.or(op("ArcA"), op("Fnr")), not.left());
    }

    @Test
    @DisplayName("Should build a single operand as a leaf")
    void shouldBuildLeaf() {
        assertEquals(op("NOT_ArcA"), build("NOT_ArcA"));
    }

    @Test
    @DisplayName("Should fail when an operator is missing an operand")
    void shouldFailOnUnderflow() {
        StructuralParseException e = assertThrows(StructuralParseException.class, () -> build("AND A"));
        assertTrue(e.getMessage().contains("missing an operand"));

        assertThrows(StructuralParseException.class, () -> build("NOT"));
    }

    @Test
    @DisplayName("Should fail when more than one root remains")
    void shouldFailOnSeveralRoots() {
        StructuralParseException e = assertThrows(StructuralParseException.class, () -> build("A B"));
        assertTrue(e.getMessage().contains("2 roots"));
    }

    @Test
    @DisplayName("Should fail on an empty stream or a parenthesis token")
    void shouldFailOnInvalidStream() {
        assertThrows(StructuralParseException.class, () -> new ExpressionTreeBuilder(List.of()).build());
        assertThrows(StructuralParseException.class, () -> build("( A"));
    }

    @Test
    @DisplayName("Should reject operator nodes typed as operand")
    void shouldRejectOperandTypedOperator() {
        assertThrows(IllegalArgumentException.class, () -> new OperatorNode(NodeType.OPERAND, null, null));
    }

    @Test
    @DisplayName("Should render in-order, pre-order and post-order traversals")
    void shouldRenderTraversals() {
        ExpressionNode root = build("OR AND A B C");

        assertEquals("A AND B OR C", TreeTraversals.inOrder(root));
        assertEquals("OR AND A B C", TreeTraversals.preOrder(root));
        assertEquals("A B AND C OR", TreeTraversals.postOrder(root));

        ExpressionNode not = build("NOT A");
        assertEquals("A NOT", TreeTraversals.inOrder(not));
        assertEquals("NOT A", TreeTraversals.preOrder(not));
        assertEquals("A NOT", TreeTraversals.postOrder(not));
    }
}
