package com.vocabgraph.wordgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "words")
public class Word {

    @Id
    private String id;

    @Indexed
    private String word;            // Display text as entered

    @Indexed(unique = true)
    private String normalizedWord;  // Trimmed lower-case form, used for dedup and lookup

    private int length;

    private Integer frequencyRank;  // Lower is more common

    @Builder.Default
    private boolean common = true;

    private String etymology;

    @Builder.Default
    private String description = "";

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static String normalize(String text) {
        return text == null ? null : text.trim().toLowerCase(Locale.ROOT);
    }
}
