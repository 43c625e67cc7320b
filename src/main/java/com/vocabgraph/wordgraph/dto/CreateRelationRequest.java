package com.vocabgraph.wordgraph.dto;

import com.vocabgraph.wordgraph.model.RelationType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRelationRequest {

    @NotBlank(message = "Source word id is required")
    private String sourceWordId;

    @NotBlank(message = "Target word id is required")
    private String targetWordId;

    @DecimalMin(value = "0.0", message = "Strength must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Strength must be between 0 and 1")
    private Double strength;    // Defaults to 1.0

    private RelationType relationType;

    @Size(max = 50, message = "Title must be at most 50 characters")
    private String title;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;
}
