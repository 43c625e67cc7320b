package com.vocabgraph.wordgraph.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateWordRequest {

    @NotBlank(message = "Word text is required")
    @Size(max = 100, message = "Word text must be at most 100 characters")
    private String word;

    @Positive(message = "Frequency rank must be positive")
    private Integer frequencyRank;

    private Boolean common;

    private String etymology;

    private String description;
}
