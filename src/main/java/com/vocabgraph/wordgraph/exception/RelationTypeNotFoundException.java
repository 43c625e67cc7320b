package com.vocabgraph.wordgraph.exception;

public class RelationTypeNotFoundException extends RuntimeException {

    public RelationTypeNotFoundException(String message) {
        super(message);
    }
}
