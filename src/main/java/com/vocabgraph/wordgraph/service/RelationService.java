package com.vocabgraph.wordgraph.service;

import com.vocabgraph.wordgraph.dto.CreateRelationRequest;
import com.vocabgraph.wordgraph.dto.RelationResponse;
import com.vocabgraph.wordgraph.dto.UpdateRelationRequest;
import com.vocabgraph.wordgraph.exception.DuplicateRelationException;
import com.vocabgraph.wordgraph.exception.RelationNotFoundException;
import com.vocabgraph.wordgraph.exception.WordNotFoundException;
import com.vocabgraph.wordgraph.model.WordRelation;
import com.vocabgraph.wordgraph.repository.RelationTypeDefinitionRepository;
import com.vocabgraph.wordgraph.repository.WordRelationRepository;
import com.vocabgraph.wordgraph.repository.WordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maintains the relation edges that graph traversal walks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelationService {

    private final WordRelationRepository wordRelationRepository;
    private final WordRepository wordRepository;
    private final RelationTypeDefinitionRepository relationTypeRepository;

    public RelationResponse createRelation(CreateRelationRequest request) {
        String sourceId = request.getSourceWordId();
        String targetId = request.getTargetWordId();
        log.info("Creating {} relation from {} to {}", request.getRelationType(), sourceId, targetId);

        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Source and target words must be different");
        }
        requireWord(sourceId);
        requireWord(targetId);

        if (wordRelationRepository.existsBySourceWordIdAndTargetWordIdAndRelationType(
                sourceId, targetId, request.getRelationType())) {
            throw new DuplicateRelationException("Relation already exists from " + sourceId + " to " + targetId
                    + " with type " + request.getRelationType());
        }

        WordRelation relation = WordRelation.builder()
                .sourceWordId(sourceId)
                .targetWordId(targetId)
                .strength(request.getStrength() != null ? request.getStrength() : WordRelation.DEFAULT_STRENGTH)
                .relationType(request.getRelationType())
                .title(request.getTitle())
                .description(request.getDescription() != null ? request.getDescription() : "")
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();

        WordRelation saved = wordRelationRepository.save(relation);
        log.info("Relation created successfully with id: {}", saved.getId());

        return mapToResponse(saved);
    }

    public RelationResponse getRelationById(String id) {
        log.info("Fetching relation with id: {}", id);
        return mapToResponse(findRelation(id));
    }

    public RelationResponse updateRelation(String id, UpdateRelationRequest request) {
        log.info("Updating relation with id: {}", id);

        WordRelation relation = findRelation(id);

        if (request.getStrength() != null) {
            relation.setStrength(request.getStrength());
        }
        if (request.getRelationType() != null && request.getRelationType() != relation.getRelationType()) {
            if (wordRelationRepository.existsBySourceWordIdAndTargetWordIdAndRelationType(
                    relation.getSourceWordId(), relation.getTargetWordId(), request.getRelationType())) {
                throw new DuplicateRelationException("Relation already exists from " + relation.getSourceWordId()
                        + " to " + relation.getTargetWordId() + " with type " + request.getRelationType());
            }
            relation.setRelationType(request.getRelationType());
        }
        if (request.getTitle() != null) {
            relation.setTitle(request.getTitle());
        }
        if (request.getDescription() != null) {
            relation.setDescription(request.getDescription());
        }
        relation.setUpdatedAt(LocalDateTime.now());

        WordRelation updated = wordRelationRepository.save(relation);
        log.info("Relation updated successfully with id: {}", updated.getId());

        return mapToResponse(updated);
    }

    public void deleteRelation(String id) {
        log.info("Deleting relation with id: {}", id);

        if (!wordRelationRepository.existsById(id)) {
            throw new RelationNotFoundException("Relation not found with id: " + id);
        }
        long removedTypes = relationTypeRepository.deleteByRelationId(id);
        wordRelationRepository.deleteById(id);
        log.info("Relation {} deleted along with {} type records", id, removedTypes);
    }

    public List<RelationResponse> getOutgoingRelations(String wordId, int page, int size) {
        log.info("Fetching outgoing relations for word: {}", wordId);
        requireWord(wordId);

        return wordRelationRepository.findBySourceWordId(wordId, Paging.byId(page, size)).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public List<RelationResponse> getIncomingRelations(String wordId, int page, int size) {
        log.info("Fetching incoming relations for word: {}", wordId);
        requireWord(wordId);

        return wordRelationRepository.findByTargetWordId(wordId, Paging.byId(page, size)).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public List<RelationResponse> getAllRelations(String wordId, int page, int size) {
        log.info("Fetching all relations for word: {}", wordId);
        requireWord(wordId);

        return wordRelationRepository.findByWordId(wordId, Paging.byId(page, size)).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    /**
     * Direct relations from source to target; the reverse direction is not included.
     */
    public List<RelationResponse> getRelationsBetween(String sourceId, String targetId) {
        log.info("Fetching relations between {} and {}", sourceId, targetId);

        return wordRelationRepository.findBySourceWordIdAndTargetWordId(sourceId, targetId).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    private WordRelation findRelation(String id) {
        return wordRelationRepository.findById(id)
                .orElseThrow(() -> new RelationNotFoundException("Relation not found with id: " + id));
    }

    private void requireWord(String wordId) {
        if (!wordRepository.existsById(wordId)) {
            throw new WordNotFoundException("Word not found with id: " + wordId);
        }
    }

    private RelationResponse mapToResponse(WordRelation relation) {
        return RelationResponse.builder()
                .id(relation.getId())
                .sourceWordId(relation.getSourceWordId())
                .targetWordId(relation.getTargetWordId())
                .strength(relation.getStrength())
                .relationType(relation.getRelationType())
                .relationCategory(relation.getRelationType() != null ? relation.getRelationType().getCategory() : null)
                .title(relation.getTitle())
                .description(relation.getDescription())
                .createdAt(relation.getCreatedAt())
                .updatedAt(relation.getUpdatedAt())
                .build();
    }
}
