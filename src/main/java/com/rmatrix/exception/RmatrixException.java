package com.rmatrix.exception;

/**
 * Base exception for rule conversion.
 */
public class RmatrixException extends RuntimeException {

    public RmatrixException(String message) {
        super(message);
    }

    public RmatrixException(String message, Throwable cause) {
        super(message, cause);
    }
}
