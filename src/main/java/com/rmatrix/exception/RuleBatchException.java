package com.rmatrix.exception;

/**
 * Exception thrown when a rules file cannot be read or one of its rules
 * fails to convert in fail-fast mode.
 */
public class RuleBatchException extends RmatrixException {

    public RuleBatchException(String message) {
        super(message);
    }

    public RuleBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
