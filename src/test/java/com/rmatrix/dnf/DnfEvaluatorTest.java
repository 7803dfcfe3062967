package com.rmatrix.dnf;

import com.rmatrix.exception.IncompleteOperatorException;
import com.rmatrix.rule.tree.ExpressionNode;
import com.rmatrix.rule.tree.NodeType;
import com.rmatrix.rule.tree.OperandNode;
import com.rmatrix.rule.tree.OperatorNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.rmatrix.rule.tree.OperatorNode.and;
import static com.rmatrix.rule.tree.OperatorNode.not;
import static com.rmatrix.rule.tree.OperatorNode.or;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DnfEvaluator.
 */
class DnfEvaluatorTest {

    private final ExpressionNode a = new OperandNode("a");
    private final ExpressionNode b = new OperandNode("b");
    private final ExpressionNode c = new OperandNode("c");
    private final ExpressionNode d = new OperandNode("d");

    private DnfEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new DnfEvaluator();
    }

    @Test
    @DisplayName("Should reduce an operand to a single literal")
    void shouldReduceOperand() {
        DnfExpression dnf = evaluator.evaluate(a);

        assertEquals(List.of(List.of("a")), dnf.clauses());
        assertEquals(ClauseDeduplication.TEXTUAL, evaluator.getDeduplication());
    }

    @Test
    @DisplayName("NOT over AND should become OR of negated literals")
    void shouldApplyDeMorganToAnd() {
        DnfExpression dnf = evaluator.evaluate(not(and(a, b)));

        assertEquals("NOT_a OR NOT_b", dnf.toString());
        assertEquals(evaluator.evaluate(or(new OperandNode("NOT_a"), new OperandNode("NOT_b"))), dnf);
    }

    @Test
    @DisplayName("NOT over OR should become AND of negated literals")
    void shouldApplyDeMorganToOr() {
        DnfExpression dnf = evaluator.evaluate(not(or(a, b)));

        assertEquals("NOT_a AND NOT_b", dnf.toString());
        assertEquals(1, dnf.clauseCount());
    }

    @Test
    @DisplayName("Double negation should cancel")
    void shouldCancelDoubleNegation() {
        assertEquals(evaluator.evaluate(a), evaluator.evaluate(not(not(a))));
        assertEquals("a", evaluator.evaluate(not(new OperandNode("NOT_a"))).toString());
    }

    @Test
    @DisplayName("AND over OR should distribute into one clause per pair")
    void shouldDistribute() {
        DnfExpression dnf = evaluator.evaluate(and(or(a, b), c));
        assertEquals(Set.of(List.of("a", "c"), List.of("b", "c")), new HashSet<>(dnf.clauses()));

        DnfExpression product = evaluator.evaluate(and(or(a, b), or(c, d)));
        assertEquals(4, product.clauseCount());
        assertEquals(Set.of(List.of("a", "c"), List.of("a", "d"), List.of("b", "c"), List.of("b", "d")),
                new HashSet<>(product.clauses()));
    }

    @Test
    @DisplayName("AND of single clauses should stay one clause")
    void shouldJoinSingleClauses() {
        DnfExpression dnf = evaluator.evaluate(and(and(a, b), c));

        assertEquals(List.of(List.of("a", "b", "c")), dnf.clauses());
    }

    @Test
    @DisplayName("OR should keep duplicate clauses")
    void shouldKeepDuplicatesUnderOr() {
        DnfExpression dnf = evaluator.evaluate(or(a, a));

        assertEquals("a OR a", dnf.toString());
        assertEquals(2, dnf.clauseCount());
    }

    @Test
    @DisplayName("Distribution should drop duplicate clauses")
    void shouldDeduplicateWhenDistributing() {
        DnfExpression dnf = evaluator.evaluate(and(or(a, a), b));

        assertEquals(List.of(List.of("a", "b")), dnf.clauses());
    }

    @Test
    @DisplayName("Canonical deduplication should collapse permuted clauses that textual keeps")
    void shouldCollapsePermutedClausesCanonically() {
        ExpressionNode tree = and(or(and(a, b), and(b, a)), c);

        DnfExpression textual = new DnfEvaluator(ClauseDeduplication.TEXTUAL).evaluate(tree);
        DnfExpression canonical = new DnfEvaluator(ClauseDeduplication.CANONICAL).evaluate(tree);

        assertEquals(List.of(List.of("a", "b", "c"), List.of("b", "a", "c")), textual.clauses());
        assertEquals(List.of(List.of("a", "b", "c")), canonical.clauses());
    }

    @Test
    @DisplayName("Result should never contain parentheses or a bare NOT")
    void shouldProduceFlatLiterals() {
        DnfExpression dnf = evaluator.evaluate(not(and(or(a, not(b)), c)));

        for (String token : dnf.tokens()) {
            assertNotEquals("NOT", token);
            assertNotEquals("(", token);
            assertNotEquals(")", token);
        }
    }

    @Test
    @DisplayName("Negation should rewrite the linear form of a multi-clause operand")
    void shouldNegateLinearForm() {
        // a AND b OR c  ->  NOT_a OR NOT_b AND NOT_c
        DnfExpression dnf = evaluator.evaluate(not(or(and(a, b), c)));

        assertEquals(List.of(List.of("NOT_a"), List.of("NOT_b", "NOT_c")), dnf.clauses());
    }

    @Test
    @DisplayName("Should fail on operators with a missing child")
    void shouldFailOnIncompleteOperator() {
        IncompleteOperatorException e = assertThrows(IncompleteOperatorException.class,
                () -> evaluator.evaluate(new OperatorNode(NodeType.AND, a, null)));
        assertTrue(e.getMessage().contains("AND node is missing its right operand"));

        assertThrows(IncompleteOperatorException.class,
                () -> evaluator.evaluate(new OperatorNode(NodeType.NOT, null, null)));
        assertThrows(IncompleteOperatorException.class, () -> evaluator.evaluate(null));
    }
}
