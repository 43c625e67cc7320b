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
 * Additional classification attached to a relation. A relation may carry several,
 * one per type name; they are removed together with the relation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "relation_types")
@CompoundIndex(name = "relation_type_name_idx", def = "{'relationId': 1, 'typeName': 1}", unique = true)
public class RelationTypeDefinition {

    @Id
    private String id;

    @Indexed
    private String relationId;

    private RelationCategory category;  // Always the category of typeName

    private RelationType typeName;

    private String title;

    private String description;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
