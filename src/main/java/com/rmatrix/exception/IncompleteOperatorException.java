package com.rmatrix.exception;

/**
 * Exception thrown when an operator node lacks a required child at evaluation time.
 */
public class IncompleteOperatorException extends RmatrixException {

    public IncompleteOperatorException(String message) {
        super(message);
    }
}
