package com.vocabgraph.wordgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upper bounds a single traversal request may ask for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalLimits {

    private int maxPathLength;  // Path finder: rejected above this
    private int maxPaths;       // Path finder: rejected above this
    private int maxLevel;       // Neighborhood: clamped to this
    private int maxNodes;       // Neighborhood: clamped to this
}
