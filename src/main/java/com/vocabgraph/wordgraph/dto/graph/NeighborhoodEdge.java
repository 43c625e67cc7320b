package com.vocabgraph.wordgraph.dto.graph;

import com.vocabgraph.wordgraph.model.RelationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NeighborhoodEdge {

    private String relationId;
    private String source;      // Word the edge was expanded from
    private String target;      // Word the edge leads to
    private int level;          // Level at which target was first discovered
    private double strength;
    private RelationType relationType;
}
