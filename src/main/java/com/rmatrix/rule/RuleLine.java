package com.rmatrix.rule;

/**
 * A rule line split into its target and its boolean expression.
 *
 * @param target Sanitized target name (no whitespace, no quotes)
 * @param rule   Rule text following the target
 */
public record RuleLine(String target, String rule) {
}
