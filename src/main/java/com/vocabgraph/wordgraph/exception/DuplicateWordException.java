package com.vocabgraph.wordgraph.exception;

public class DuplicateWordException extends RuntimeException {

    public DuplicateWordException(String message) {
        super(message);
    }
}
