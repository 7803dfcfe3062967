package com.rmatrix.dnf;

import com.rmatrix.exception.IncompleteOperatorException;
import com.rmatrix.rule.expression.RuleSyntax;
import com.rmatrix.rule.tree.ExpressionNode;
import com.rmatrix.rule.tree.OperandNode;
import com.rmatrix.rule.tree.OperatorNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces an expression tree to disjunctive normal form.
 * <p>
 * Post-order recursion:
 * <ul>
 *   <li>Operand: the operand name as a single literal.</li>
 *   <li>NOT: the reduced child is rewritten token by token. AND and OR
 *       separators swap and every literal is negated
 *       ({@code x <-> NOT_x}). The rewrite works on the child's linear
 *       form, so a multi-clause child is regrouped by the usual
 *       AND-before-OR reading of the result.</li>
 *   <li>AND: with a single clause on both sides the clauses are joined.
 *       Otherwise the AND is distributed: every left clause is paired with
 *       every right clause and duplicate pairs are dropped according to
 *       the configured {@link ClauseDeduplication}.</li>
 *   <li>OR: both clause lists are concatenated; duplicates are kept.</li>
 * </ul>
 * <p>
 * Distribution is multiplicative: nested AND-over-OR structure can grow the
 * clause count exponentially in the number of OR branches. That is the cost
 * of DNF conversion and is not bounded here.
 * <p>
 * Instances hold no mutable state and can be shared across threads.
 */
public class DnfEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DnfEvaluator.class);

    private final ClauseDeduplication deduplication;

    public DnfEvaluator() {
        this(ClauseDeduplication.TEXTUAL);
    }

    public DnfEvaluator(ClauseDeduplication deduplication) {
        this.deduplication = deduplication;
    }

    public ClauseDeduplication getDeduplication() {
        return deduplication;
    }

    /**
     * Evaluate a tree.
     *
     * @param node Root of the tree
     * @return DNF of the tree
     * @throws IncompleteOperatorException if an operator lacks a required child
     */
    public DnfExpression evaluate(ExpressionNode node) {
        if (node == null) {
            throw new IncompleteOperatorException("Cannot evaluate an empty expression tree");
        }

        DnfExpression result;
        if (node instanceof OperatorNode operator) {
            result = switch (operator.type()) {
                case NOT -> negate(evaluate(child(operator, operator.left(), "operand")));
                case AND -> conjoin(
                        evaluate(child(operator, operator.left(), "left operand")),
                        evaluate(child(operator, operator.right(), "right operand")));
                case OR -> disjoin(
                        evaluate(child(operator, operator.left(), "left operand")),
                        evaluate(child(operator, operator.right(), "right operand")));
                case OPERAND -> throw new IllegalStateException("Operator node typed as operand");
            };
        } else {
            result = DnfExpression.literal(((OperandNode) node).name());
        }

        log.trace("{} -> {}", node.label(), result);
        return result;
    }

    private DnfExpression negate(DnfExpression operand) {
        List<String> tokens = operand.tokens();
        List<String> flipped = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            switch (token) {
                case RuleSyntax.AND -> flipped.add(RuleSyntax.OR);
                case RuleSyntax.OR -> flipped.add(RuleSyntax.AND);
                default -> flipped.add(RuleSyntax.negate(token));
            }
        }
        return DnfExpression.fromTokens(flipped);
    }

    private DnfExpression conjoin(DnfExpression left, DnfExpression right) {
        if (!left.hasDisjunction() && !right.hasDisjunction()) {
            List<String> clause = new ArrayList<>(left.clauses().get(0));
            clause.addAll(right.clauses().get(0));
            return DnfExpression.of(List.of(clause));
        }

        Map<Object, List<String>> unique = new LinkedHashMap<>();
        for (List<String> leftClause : left.clauses()) {
            for (List<String> rightClause : right.clauses()) {
                List<String> clause = new ArrayList<>(leftClause.size() + rightClause.size());
                clause.addAll(leftClause);
                clause.addAll(rightClause);
                unique.putIfAbsent(deduplication.key(clause), clause);
            }
        }

        log.trace("Distributed {} x {} clauses into {}", left.clauseCount(), right.clauseCount(), unique.size());
        return DnfExpression.of(new ArrayList<>(unique.values()));
    }

    private DnfExpression disjoin(DnfExpression left, DnfExpression right) {
        List<List<String>> clauses = new ArrayList<>(left.clauses());
        clauses.addAll(right.clauses());
        return DnfExpression.of(clauses);
    }

    private ExpressionNode child(OperatorNode operator, ExpressionNode child, String role) {
        if (child == null) {
            throw new IncompleteOperatorException(operator.type() + " node is missing its " + role);
        }
        return child;
    }
}
