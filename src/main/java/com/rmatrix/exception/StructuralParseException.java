package com.rmatrix.exception;

/**
 * Exception thrown when a prefix token stream cannot be consumed into
 * exactly one expression tree.
 */
public class StructuralParseException extends RmatrixException {

    public StructuralParseException(String message) {
        super(message);
    }
}
