package com.vocabgraph.wordgraph.dto.graph;

/**
 * Which end of a relation the expanded word sits on.
 */
public enum EdgeDirection {
    OUTGOING,   // word is the source, neighbor is the target
    INCOMING    // word is the target, neighbor is the source
}
