package com.rmatrix.batch;

/**
 * A rules-file line that failed to convert.
 *
 * @param lineNumber 1-based line number in the source
 * @param line       Line text
 * @param message    Failure message
 */
public record RuleFailure(int lineNumber, String line, String message) {
}
