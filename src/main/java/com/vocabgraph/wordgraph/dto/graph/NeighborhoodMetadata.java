package com.vocabgraph.wordgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective bounds and size of a neighborhood projection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NeighborhoodMetadata {

    private int nodeCount;
    private int edgeCount;
    private int maxLevel;
    private int maxNodes;
    private int maxEdgesPerNode;    // 0 when unbounded
    private boolean truncated;      // true when the node cap stopped the expansion
}
