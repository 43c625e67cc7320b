package com.vocabgraph.wordgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WordResponse {

    private String id;
    private String word;
    private String normalizedWord;
    private int length;
    private Integer frequencyRank;
    private boolean common;
    private String etymology;
    private String description;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
