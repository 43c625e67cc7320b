package com.vocabgraph.wordgraph.exception;

/**
 * Malformed traversal bounds (negative counts, max below min, above a configured ceiling).
 * Raised before any store access.
 */
public class InvalidTraversalArgumentException extends IllegalArgumentException {

    public InvalidTraversalArgumentException(String message) {
        super(message);
    }
}
