package com.rmatrix.rule.expression;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reserved words and symbols of the rule syntax.
 * Shared read-only by every conversion.
 */
public final class RuleSyntax {

    private RuleSyntax() {
    }

    public static final String AND = "AND";
    public static final String OR = "OR";
    public static final String NOT = "NOT";
    public static final String LEFT_PAREN = "(";
    public static final String RIGHT_PAREN = ")";

    /**
     * Structural tokens mapped to token types. Anything else is an operand.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            LEFT_PAREN, TokenType.LPAREN,
            RIGHT_PAREN, TokenType.RPAREN,
            AND, TokenType.AND,
            OR, TokenType.OR,
            NOT, TokenType.NOT
    );

    /**
     * Logical keywords that may not appear inside operand names.
     */
    public static final Set<String> RESERVED_WORDS = Set.of(AND, OR, NOT);

    /**
     * Order in which the reformatter separates structural tokens.
     */
    public static final List<String> SEPARATION_ORDER = List.of(LEFT_PAREN, RIGHT_PAREN, NOT, AND, OR);

    /**
     * Prefix marking a pre-negated literal, e.g. {@code NOT_ArcA}.
     */
    public static final String NEGATION_PREFIX = "NOT_";

    /**
     * Comparison suffixes rewritten to operand-safe literals.
     */
    public static final Map<String, String> COMPARISON_LITERALS = Map.of(
            ">0", "_gt_0",
            "<0", "_lt_0"
    );

    public static final char QUOTE = '"';
    public static final char UNDERSCORE = '_';

    public static boolean isNegated(String literal) {
        return literal.startsWith(NEGATION_PREFIX);
    }

    /**
     * Negate a literal: {@code x -> NOT_x}, {@code NOT_x -> x}.
     */
    public static String negate(String literal) {
        if (isNegated(literal)) {
            return literal.substring(NEGATION_PREFIX.length());
        }
        return NEGATION_PREFIX + literal;
    }
}
