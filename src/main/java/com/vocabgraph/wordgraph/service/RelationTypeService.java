package com.vocabgraph.wordgraph.service;

import com.vocabgraph.wordgraph.dto.CreateRelationTypeRequest;
import com.vocabgraph.wordgraph.dto.RelationTypeResponse;
import com.vocabgraph.wordgraph.dto.UpdateRelationTypeRequest;
import com.vocabgraph.wordgraph.exception.DuplicateRelationTypeException;
import com.vocabgraph.wordgraph.exception.RelationNotFoundException;
import com.vocabgraph.wordgraph.exception.RelationTypeNotFoundException;
import com.vocabgraph.wordgraph.model.RelationCategory;
import com.vocabgraph.wordgraph.model.RelationType;
import com.vocabgraph.wordgraph.model.RelationTypeDefinition;
import com.vocabgraph.wordgraph.repository.RelationTypeDefinitionRepository;
import com.vocabgraph.wordgraph.repository.WordRelationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Type records attached to relations. The category of a record always matches its type name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelationTypeService {

    private final RelationTypeDefinitionRepository relationTypeRepository;
    private final WordRelationRepository wordRelationRepository;

    public RelationTypeResponse createRelationType(CreateRelationTypeRequest request) {
        String relationId = request.getRelationId();
        log.info("Adding type {} to relation {}", request.getTypeName(), relationId);

        RelationCategory category = resolveCategory(request.getTypeName(), request.getCategory());
        requireRelation(relationId);

        if (relationTypeRepository.existsByRelationIdAndTypeName(relationId, request.getTypeName())) {
            throw new DuplicateRelationTypeException("Relation " + relationId
                    + " already has type " + request.getTypeName());
        }

        RelationTypeDefinition definition = RelationTypeDefinition.builder()
                .relationId(relationId)
                .category(category)
                .typeName(request.getTypeName())
                .title(request.getTitle())
                .description(request.getDescription())
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();

        RelationTypeDefinition saved = relationTypeRepository.save(definition);
        log.info("Relation type created successfully with id: {}", saved.getId());

        return mapToResponse(saved);
    }

    public RelationTypeResponse getRelationTypeById(String id) {
        log.info("Fetching relation type with id: {}", id);
        return mapToResponse(findDefinition(id));
    }

    public List<RelationTypeResponse> getTypesForRelation(String relationId) {
        log.info("Fetching types for relation: {}", relationId);
        requireRelation(relationId);

        return relationTypeRepository.findByRelationIdOrderByIdAsc(relationId).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public RelationTypeResponse updateRelationType(String id, UpdateRelationTypeRequest request) {
        log.info("Updating relation type with id: {}", id);

        RelationTypeDefinition definition = findDefinition(id);

        RelationType typeName = request.getTypeName() != null ? request.getTypeName() : definition.getTypeName();
        if (typeName != definition.getTypeName()
                && relationTypeRepository.existsByRelationIdAndTypeName(definition.getRelationId(), typeName)) {
            throw new DuplicateRelationTypeException("Relation " + definition.getRelationId()
                    + " already has type " + typeName);
        }
        definition.setCategory(resolveCategory(typeName, request.getCategory()));
        definition.setTypeName(typeName);

        if (request.getTitle() != null) {
            definition.setTitle(request.getTitle());
        }
        if (request.getDescription() != null) {
            definition.setDescription(request.getDescription());
        }
        definition.setUpdatedAt(LocalDateTime.now());

        RelationTypeDefinition updated = relationTypeRepository.save(definition);
        log.info("Relation type updated successfully with id: {}", updated.getId());

        return mapToResponse(updated);
    }

    public void deleteRelationType(String id) {
        log.info("Deleting relation type with id: {}", id);

        if (!relationTypeRepository.existsById(id)) {
            throw new RelationTypeNotFoundException("Relation type not found with id: " + id);
        }
        relationTypeRepository.deleteById(id);
    }

    private RelationCategory resolveCategory(RelationType typeName, RelationCategory requested) {
        if (requested != null && requested != typeName.getCategory()) {
            throw new IllegalArgumentException("Type " + typeName + " belongs to category "
                    + typeName.getCategory() + ", not " + requested);
        }
        return typeName.getCategory();
    }

    private RelationTypeDefinition findDefinition(String id) {
        return relationTypeRepository.findById(id)
                .orElseThrow(() -> new RelationTypeNotFoundException("Relation type not found with id: " + id));
    }

    private void requireRelation(String relationId) {
        if (!wordRelationRepository.existsById(relationId)) {
            throw new RelationNotFoundException("Relation not found with id: " + relationId);
        }
    }

    private RelationTypeResponse mapToResponse(RelationTypeDefinition definition) {
        return RelationTypeResponse.builder()
                .id(definition.getId())
                .relationId(definition.getRelationId())
                .category(definition.getCategory())
                .typeName(definition.getTypeName())
                .title(definition.getTitle())
                .description(definition.getDescription())
                .createdAt(definition.getCreatedAt())
                .updatedAt(definition.getUpdatedAt())
                .build();
    }
}
