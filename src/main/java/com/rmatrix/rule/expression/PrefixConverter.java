package com.rmatrix.rule.expression;

import com.rmatrix.exception.MalformedInputException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Converts an infix token stream into prefix notation.
 * <p>
 * Operator-precedence stack conversion run over the reversed stream
 * (precedence: NOT > AND > OR, parentheses override):
 * <ul>
 *   <li>operands go straight to the output</li>
 *   <li>{@code )} is pushed as a boundary marker</li>
 *   <li>{@code (} pops operators to the output until its marker</li>
 *   <li>NOT is always pushed</li>
 *   <li>AND first pops pending NOTs, OR first pops pending NOTs and ANDs</li>
 * </ul>
 * The output is reversed once more to give the prefix stream, which
 * contains no parentheses.
 * <pre>
 * ( A AND B ) OR C   ->   OR AND A B C
 * </pre>
 */
public final class PrefixConverter {

    private final String input;
    private final List<Token> tokens;

    public PrefixConverter(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
    }

    /**
     * Convert the token stream.
     *
     * @return Prefix token stream
     */
    public List<Token> convert() {
        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> operators = new ArrayDeque<>();

        for (int i = tokens.size() - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case OPERAND -> output.add(token);
                case RPAREN -> operators.push(token);
                case LPAREN -> popUntilMarker(token, operators, output);
                case NOT -> operators.push(token);
                case AND -> {
                    while (!operators.isEmpty() && operators.peek().is(TokenType.NOT)) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }
                case OR -> {
                    while (!operators.isEmpty()
                            && (operators.peek().is(TokenType.NOT) || operators.peek().is(TokenType.AND))) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }
            }
        }

        while (!operators.isEmpty()) {
            Token op = operators.pop();
            if (op.is(TokenType.RPAREN)) {
                throw error("Unmatched ')'", op);
            }
            output.add(op);
        }

        Collections.reverse(output);
        return output;
    }

    private void popUntilMarker(Token open, Deque<Token> operators, List<Token> output) {
        while (!operators.isEmpty() && !operators.peek().is(TokenType.RPAREN)) {
            output.add(operators.pop());
        }
        if (operators.isEmpty()) {
            throw error("Unmatched '('", open);
        }
        operators.pop();
    }

    private MalformedInputException error(String message, Token token) {
        return new MalformedInputException("Invalid rule at token " + token.position()
                + ": " + message + " in '" + input + "'");
    }
}
