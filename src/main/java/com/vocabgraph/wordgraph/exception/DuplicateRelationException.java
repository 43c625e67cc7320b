package com.vocabgraph.wordgraph.exception;

public class DuplicateRelationException extends RuntimeException {

    public DuplicateRelationException(String message) {
        super(message);
    }
}
