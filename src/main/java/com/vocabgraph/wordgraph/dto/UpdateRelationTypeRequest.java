package com.vocabgraph.wordgraph.dto;

import com.vocabgraph.wordgraph.model.RelationCategory;
import com.vocabgraph.wordgraph.model.RelationType;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRelationTypeRequest {

    private RelationCategory category;

    private RelationType typeName;

    @Size(max = 50, message = "Title must be at most 50 characters")
    private String title;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;
}
