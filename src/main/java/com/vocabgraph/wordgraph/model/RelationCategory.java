package com.vocabgraph.wordgraph.model;

public enum RelationCategory {
    SEMANTIC,
    FORMAL,
    MORPHOLOGICAL,
    ASSOCIATIVE
}
