package com.rmatrix.rule.expression;

/**
 * Represents a token of a reformatted rule.
 *
 * @param type     Token type
 * @param text     Token text (keyword, parenthesis or operand name)
 * @param position Index of the token in the reformatted token stream
 */
public record Token(TokenType type, String text, int position) {

    /**
     * Classify a single token text.
     */
    public static Token of(String text, int position) {
        TokenType type = RuleSyntax.KEYWORDS.getOrDefault(text, TokenType.OPERAND);
        return new Token(type, text, position);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
