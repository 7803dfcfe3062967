package com.rmatrix.dnf;

import com.rmatrix.exception.MalformedInputException;
import com.rmatrix.rule.expression.RuleSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A boolean expression in disjunctive normal form.
 * <p>
 * Clauses are OR-connected, the literals of a clause are AND-connected.
 * The text form separates clauses with {@code OR} and literals with
 * {@code AND}:
 * <pre>
 * a AND b OR NOT_c
 * </pre>
 * Instances never contain parentheses or a bare NOT; negation is carried by
 * the {@code NOT_} literal prefix. Clause order is kept but carries no
 * meaning, and duplicate clauses are allowed.
 */
public final class DnfExpression {

    static final String AND_SEPARATOR = " " + RuleSyntax.AND + " ";
    static final String OR_SEPARATOR = " " + RuleSyntax.OR + " ";

    private final List<List<String>> clauses;

    private DnfExpression(List<List<String>> clauses) {
        this.clauses = clauses;
    }

    /**
     * Create an expression from clauses.
     *
     * @param clauses Non-empty list of non-empty literal lists
     */
    public static DnfExpression of(List<List<String>> clauses) {
        if (clauses == null || clauses.isEmpty()) {
            throw new MalformedInputException("DNF expression requires at least one clause");
        }
        List<List<String>> copy = new ArrayList<>(clauses.size());
        for (List<String> clause : clauses) {
            if (clause == null || clause.isEmpty()) {
                throw new MalformedInputException("DNF expression contains an empty clause");
            }
            copy.add(List.copyOf(clause));
        }
        return new DnfExpression(List.copyOf(copy));
    }

    /**
     * A single literal, i.e. one clause of one literal.
     */
    public static DnfExpression literal(String name) {
        return of(List.of(List.of(name)));
    }

    /**
     * Parse DNF text such as {@code a AND b OR c}.
     *
     * @param text DNF text
     * @return Parsed expression
     * @throws MalformedInputException if the text is empty, has an empty clause or
     *                                 contains a parenthesis or a bare NOT
     */
    public static DnfExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedInputException("DNF expression cannot be null or empty");
        }
        return fromTokens(List.of(text.trim().split("\\s+")));
    }

    /**
     * Read a linear token form: literals, AND and OR separators.
     */
    static DnfExpression fromTokens(List<String> tokens) {
        List<List<String>> clauses = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String token : tokens) {
            switch (token) {
                case RuleSyntax.OR -> {
                    clauses.add(current);
                    current = new ArrayList<>();
                }
                case RuleSyntax.AND -> {
                    // literals of a clause are implicitly AND-connected
                }
                case RuleSyntax.NOT, RuleSyntax.LEFT_PAREN, RuleSyntax.RIGHT_PAREN ->
                        throw new MalformedInputException("Token '" + token + "' is not allowed in DNF expression '"
                                + String.join(" ", tokens) + "'");
                default -> current.add(token);
            }
        }
        clauses.add(current);
        return of(clauses);
    }

    /**
     * Linear token form, e.g. {@code [a, AND, b, OR, c]}.
     */
    public List<String> tokens() {
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            if (i > 0) {
                tokens.add(RuleSyntax.OR);
            }
            List<String> clause = clauses.get(i);
            for (int j = 0; j < clause.size(); j++) {
                if (j > 0) {
                    tokens.add(RuleSyntax.AND);
                }
                tokens.add(clause.get(j));
            }
        }
        return tokens;
    }

    public List<List<String>> clauses() {
        return clauses;
    }

    public int clauseCount() {
        return clauses.size();
    }

    /**
     * Whether the expression has more than one clause.
     */
    public boolean hasDisjunction() {
        return clauses.size() > 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DnfExpression other)) return false;
        return clauses.equals(other.clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        return clauses.stream()
                .map(clause -> String.join(AND_SEPARATOR, clause))
                .collect(Collectors.joining(OR_SEPARATOR));
    }
}
