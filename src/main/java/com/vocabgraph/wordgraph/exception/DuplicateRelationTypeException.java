package com.vocabgraph.wordgraph.exception;

public class DuplicateRelationTypeException extends RuntimeException {

    public DuplicateRelationTypeException(String message) {
        super(message);
    }
}
