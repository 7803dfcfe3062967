package com.rmatrix.rule.expression;

import com.rmatrix.exception.MalformedInputException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.rmatrix.rule.expression.RuleSyntax.*;

/**
 * Pre-conversion checks on rule text.
 */
public final class RuleValidator {

    private static final Pattern WORD = Pattern.compile("\\w+");

    private RuleValidator() {
    }

    /**
     * Run every check against a raw rule.
     *
     * @param rule Raw rule text
     * @throws MalformedInputException if any check fails
     */
    public static void validate(String rule) {
        if (rule == null || rule.isBlank()) {
            throw new MalformedInputException("Rule expression cannot be null or empty");
        }
        checkReservedWords(rule);
        checkParentheses(rule);
    }

    /**
     * Fail if the number of opening and closing parentheses differs.
     */
    public static void checkParentheses(String rule) {
        int open = 0;
        int close = 0;
        for (int i = 0; i < rule.length(); i++) {
            char c = rule.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')') {
                close++;
            }
        }
        if (open != close) {
            throw new MalformedInputException("Unbalanced parentheses (" + open + " opening, "
                    + close + " closing) in '" + rule + "'");
        }
    }

    /**
     * Fail if AND, OR or NOT appears inside an operand name, which would make
     * tokenization ambiguous. A single leading {@code NOT_} prefix is allowed.
     */
    public static void checkReservedWords(String rule) {
        Matcher matcher = WORD.matcher(RuleTokenizer.mergeQuotedOperands(rule));
        while (matcher.find()) {
            String word = matcher.group();
            if (RESERVED_WORDS.contains(word)) {
                continue;
            }
            String name = isNegated(word) ? word.substring(NEGATION_PREFIX.length()) : word;
            for (String reserved : RESERVED_WORDS) {
                if (name.contains(reserved)) {
                    throw new MalformedInputException("Reserved word '" + reserved
                            + "' embedded in operand '" + word + "' in '" + rule + "'");
                }
            }
        }
    }
}
