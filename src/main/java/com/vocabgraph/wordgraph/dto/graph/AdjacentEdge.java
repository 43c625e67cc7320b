package com.vocabgraph.wordgraph.dto.graph;

import com.vocabgraph.wordgraph.model.RelationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One relation as seen from a word being expanded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjacentEdge {

    private String neighborId;
    private String relationId;
    private EdgeDirection direction;
    private double strength;
    private RelationType relationType;  // null when the relation is untagged
}
