package com.vocabgraph.wordgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Bounded subgraph around a center word, ids only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NeighborhoodResponse {

    private String centerId;
    private List<String> nodeIds;
    private List<NeighborhoodEdge> edges;
    private NeighborhoodMetadata metadata;
}
