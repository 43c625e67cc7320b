package com.vocabgraph.wordgraph.dto;

import com.vocabgraph.wordgraph.model.RelationCategory;
import com.vocabgraph.wordgraph.model.RelationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationResponse {

    private String id;
    private String sourceWordId;
    private String targetWordId;
    private double strength;
    private RelationType relationType;
    private RelationCategory relationCategory;
    private String title;
    private String description;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
