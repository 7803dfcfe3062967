package com.rmatrix.rule;

import com.rmatrix.exception.MalformedInputException;
import com.rmatrix.rule.expression.RuleSyntax;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a raw rule line into target name and rule text.
 * <p>
 * Recognized target forms, tried in order:
 * <ul>
 *   <li>{@code GENE: rule} - the first colon separates target and rule</li>
 *   <li>a double-quoted name, {@code "lac operon" (A AND B)} - whitespace
 *       becomes {@code _}, quotes are dropped</li>
 *   <li>a b-number, {@code b0001(NOT(ArcA OR Fnr))}</li>
 *   <li>a word starting with an uppercase letter followed by whitespace</li>
 * </ul>
 */
public final class RuleLineParser {

    private static final Pattern QUOTED_TARGET = Pattern.compile("^(\".*?\")\\s+(.*)$", Pattern.DOTALL);
    private static final Pattern B_NUMBER_TARGET = Pattern.compile("^(b\\d{4})(.*)$", Pattern.DOTALL);
    private static final Pattern NAMED_TARGET = Pattern.compile("^([A-Z]\\S*)\\s+(.*)$", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Parse a rule line.
     *
     * @param line Raw line
     * @return Target and rule
     * @throws MalformedInputException if no target form matches
     */
    public RuleLine parse(String line) {
        if (line == null || line.isBlank()) {
            throw new MalformedInputException("Rule line cannot be null or empty");
        }

        String text = splitColon(line.strip());

        Matcher quoted = QUOTED_TARGET.matcher(text);
        if (quoted.matches()) {
            return new RuleLine(sanitize(quoted.group(1)), quoted.group(2).strip());
        }

        Matcher bNumber = B_NUMBER_TARGET.matcher(text);
        if (bNumber.matches()) {
            return new RuleLine(bNumber.group(1), bNumber.group(2).strip());
        }

        Matcher named = NAMED_TARGET.matcher(text);
        if (named.matches()) {
            return new RuleLine(sanitize(named.group(1)), named.group(2).strip());
        }

        throw new MalformedInputException("Format of regulator or target gene not recognized in '" + line + "'");
    }

    private static String splitColon(String line) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            return line;
        }
        return line.substring(0, colon).strip() + " " + line.substring(colon + 1).strip();
    }

    private static String sanitize(String target) {
        return WHITESPACE.matcher(target).replaceAll("_").replace(String.valueOf(RuleSyntax.QUOTE), "");
    }
}
