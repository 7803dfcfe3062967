package com.rmatrix.exception;

/**
 * Exception thrown when rule text is rejected before conversion begins.
 * Covers unbalanced or mis-ordered parentheses, reserved keywords embedded
 * in operand names and unrecognized rule lines.
 */
public class MalformedInputException extends RmatrixException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
