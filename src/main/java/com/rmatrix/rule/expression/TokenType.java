package com.rmatrix.rule.expression;

/**
 * Token types for rule expressions.
 */
public enum TokenType {
    // Operands (gene, metabolite, regulator, possibly NOT_ prefixed)
    OPERAND,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,
    NOT;

    /**
     * Whether this type is one of the logical operators.
     */
    public boolean isOperator() {
        return this == AND || this == OR || this == NOT;
    }
}
