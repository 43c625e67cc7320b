package com.vocabgraph.wordgraph.dto;

import com.vocabgraph.wordgraph.model.RelationCategory;
import com.vocabgraph.wordgraph.model.RelationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRelationTypeRequest {

    @NotBlank(message = "Relation id is required")
    private String relationId;

    private RelationCategory category;  // Derived from typeName when absent

    @NotNull(message = "Type name is required")
    private RelationType typeName;

    @Size(max = 50, message = "Title must be at most 50 characters")
    private String title;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;
}
