package com.vocabgraph.wordgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A simple path between two words.
 * relations.get(i) links path.get(i) to path.get(i + 1). A zero-length path holds only its word and no relations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WordPath {

    @Builder.Default
    private List<String> path = new ArrayList<>();

    @Builder.Default
    private List<String> relations = new ArrayList<>();

    private int length;             // Number of hops
    private double totalStrength;   // Product of hop strengths
}
