package com.vocabgraph.wordgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Directed, weighted link from one word to another.
 * Traversal may walk it in either direction; strength is the confidence of the link in [0, 1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "word_relations")
@CompoundIndex(name = "source_target_type_idx", def = "{'sourceWordId': 1, 'targetWordId': 1, 'relationType': 1}",
        unique = true)
public class WordRelation {

    public static final double DEFAULT_STRENGTH = 1.0;

    @Id
    private String id;

    @Indexed
    private String sourceWordId;

    @Indexed
    private String targetWordId;

    @Builder.Default
    private double strength = DEFAULT_STRENGTH;

    private RelationType relationType;  // Optional tag

    private String title;

    @Builder.Default
    private String description = "";

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
