package com.vocabgraph.wordgraph.exception;

/**
 * The word/relation store failed while serving a read.
 * Traversals abort on this and return no partial result.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
