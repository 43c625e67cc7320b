package com.vocabgraph.wordgraph.exception;

public class RelationNotFoundException extends RuntimeException {

    public RelationNotFoundException(String message) {
        super(message);
    }
}
