package com.rmatrix.rule.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.rmatrix.rule.expression.RuleSyntax.*;

/**
 * Reformats raw rule text into a uniformly spaced token stream.
 * <p>
 * Every parenthesis, logical keyword and operand becomes its own
 * space-delimited token:
 * <pre>
 * (NOT(ArcA OR Fnr))   ->   ( NOT ( ArcA OR Fnr ) )
 * </pre>
 * Whitespace is stripped first and reinserted around structural tokens, so
 * operands never carry inner whitespace and reformatting an already
 * reformatted rule returns it unchanged. Quoted multi-word operands are
 * merged into one underscore-joined identifier beforehand, {@code >0} and
 * {@code <0} suffixes become {@code _gt_0} and {@code _lt_0}, and a
 * {@code NOT} immediately followed by an underscore stays fused as a
 * pre-negated literal ({@code NOT_ArcA}).
 */
public final class RuleTokenizer {

    private static final Pattern QUOTED_OPERAND = Pattern.compile("\"(.*?)\"");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String input;

    public RuleTokenizer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * Reformat the rule into a single-space-delimited string.
     *
     * @return Reformatted rule, empty if the input holds no tokens
     */
    public String reformat() {
        String rule = mergeQuotedOperands(input);
        rule = WHITESPACE.matcher(rule).replaceAll("");

        for (Map.Entry<String, String> comparison : COMPARISON_LITERALS.entrySet()) {
            rule = rule.replace(comparison.getKey(), comparison.getValue());
        }

        for (String keyword : SEPARATION_ORDER) {
            rule = separate(rule, keyword);
        }

        return WHITESPACE.matcher(rule.trim()).replaceAll(" ");
    }

    /**
     * Reformat the rule and classify each token.
     *
     * @return Token stream in surface order
     */
    public List<Token> tokenize() {
        String reformatted = reformat();
        if (reformatted.isEmpty()) {
            return List.of();
        }

        String[] parts = reformatted.split(" ");
        List<Token> tokens = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            tokens.add(Token.of(parts[i], i));
        }
        return tokens;
    }

    /**
     * Replace every quoted operand with its underscore-joined, unquoted form.
     */
    static String mergeQuotedOperands(String rule) {
        Matcher matcher = QUOTED_OPERAND.matcher(rule);
        StringBuilder merged = new StringBuilder();
        while (matcher.find()) {
            String operand = WHITESPACE.matcher(matcher.group(1)).replaceAll(String.valueOf(UNDERSCORE));
            matcher.appendReplacement(merged, Matcher.quoteReplacement(operand));
        }
        matcher.appendTail(merged);
        return merged.toString();
    }

    private static String separate(String rule, String keyword) {
        String[] pieces = rule.split(Pattern.quote(keyword), -1);
        StringBuilder separated = new StringBuilder(pieces[0]);

        for (int i = 1; i < pieces.length; i++) {
            String piece = pieces[i];
            separated.append(' ').append(keyword);
            // NOT_<name> is a pre-negated literal, not an operator
            if (!(NOT.equals(keyword) && !piece.isEmpty() && piece.charAt(0) == UNDERSCORE)) {
                separated.append(' ');
            }
            separated.append(piece);
        }
        return separated.toString();
    }
}
