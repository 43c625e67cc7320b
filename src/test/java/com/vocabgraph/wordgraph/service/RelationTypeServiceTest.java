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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelationTypeServiceTest {

    @Mock
    private RelationTypeDefinitionRepository relationTypeRepository;

    @Mock
    private WordRelationRepository wordRelationRepository;

    @InjectMocks
    private RelationTypeService relationTypeService;

    private RelationTypeDefinition derivation() {
        return RelationTypeDefinition.builder()
                .id("t1")
                .relationId("r1")
                .category(RelationCategory.MORPHOLOGICAL)
                .typeName(RelationType.DERIVATION)
                .title("suffix")
                .build();
    }

    @Test
    void createRelationTypeDerivesCategory() {
        when(wordRelationRepository.existsById("r1")).thenReturn(true);
        when(relationTypeRepository.existsByRelationIdAndTypeName("r1", RelationType.DERIVATION)).thenReturn(false);
        when(relationTypeRepository.save(any(RelationTypeDefinition.class))).thenAnswer(invocation -> {
            RelationTypeDefinition definition = invocation.getArgument(0);
            definition.setId("t1");
            return definition;
        });

        RelationTypeResponse response = relationTypeService.createRelationType(CreateRelationTypeRequest.builder()
                .relationId("r1")
                .typeName(RelationType.DERIVATION)
                .title("suffix -ness")
                .build());

        ArgumentCaptor<RelationTypeDefinition> captor = ArgumentCaptor.forClass(RelationTypeDefinition.class);
        verify(relationTypeRepository).save(captor.capture());
        assertThat(captor.getValue().getCategory()).isEqualTo(RelationCategory.MORPHOLOGICAL);
        assertThat(captor.getValue().getCreatedAt()).isNotNull();
        assertThat(response.getId()).isEqualTo("t1");
        assertThat(response.getTitle()).isEqualTo("suffix -ness");
    }

    @Test
    void createRelationTypeRejectsMismatchedCategory() {
        assertThatThrownBy(() -> relationTypeService.createRelationType(CreateRelationTypeRequest.builder()
                .relationId("r1")
                .category(RelationCategory.SEMANTIC)
                .typeName(RelationType.PLURAL)
                .build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MORPHOLOGICAL");
        verifyNoInteractions(relationTypeRepository, wordRelationRepository);
    }

    @Test
    void createRelationTypeRequiresRelation() {
        when(wordRelationRepository.existsById("gone")).thenReturn(false);

        assertThatThrownBy(() -> relationTypeService.createRelationType(CreateRelationTypeRequest.builder()
                .relationId("gone")
                .typeName(RelationType.SYNONYM)
                .build()))
                .isInstanceOf(RelationNotFoundException.class);
        verify(relationTypeRepository, never()).save(any());
    }

    @Test
    void createRelationTypeRejectsSameTypeTwice() {
        when(wordRelationRepository.existsById("r1")).thenReturn(true);
        when(relationTypeRepository.existsByRelationIdAndTypeName("r1", RelationType.SYNONYM)).thenReturn(true);

        assertThatThrownBy(() -> relationTypeService.createRelationType(CreateRelationTypeRequest.builder()
                .relationId("r1")
                .typeName(RelationType.SYNONYM)
                .build()))
                .isInstanceOf(DuplicateRelationTypeException.class);
    }

    @Test
    void updateRelationTypeMovesCategoryWithTypeName() {
        when(relationTypeRepository.findById("t1")).thenReturn(Optional.of(derivation()));
        when(relationTypeRepository.existsByRelationIdAndTypeName("r1", RelationType.RELATED)).thenReturn(false);
        when(relationTypeRepository.save(any(RelationTypeDefinition.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        RelationTypeResponse response = relationTypeService.updateRelationType("t1",
                UpdateRelationTypeRequest.builder().typeName(RelationType.RELATED).build());

        assertThat(response.getTypeName()).isEqualTo(RelationType.RELATED);
        assertThat(response.getCategory()).isEqualTo(RelationCategory.ASSOCIATIVE);
        assertThat(response.getTitle()).isEqualTo("suffix");
        assertThat(response.getUpdatedAt()).isNotNull();
    }

    @Test
    void updateRelationTypeRejectsTypeAlreadyOnRelation() {
        when(relationTypeRepository.findById("t1")).thenReturn(Optional.of(derivation()));
        when(relationTypeRepository.existsByRelationIdAndTypeName("r1", RelationType.VARIANT)).thenReturn(true);

        assertThatThrownBy(() -> relationTypeService.updateRelationType("t1",
                UpdateRelationTypeRequest.builder().typeName(RelationType.VARIANT).build()))
                .isInstanceOf(DuplicateRelationTypeException.class);
        verify(relationTypeRepository, never()).save(any());
    }

    @Test
    void typesForRelationAreListedInIdOrder() {
        when(wordRelationRepository.existsById("r1")).thenReturn(true);
        when(relationTypeRepository.findByRelationIdOrderByIdAsc("r1")).thenReturn(List.of(
                derivation(),
                RelationTypeDefinition.builder().id("t2").relationId("r1").typeName(RelationType.VARIANT).build()));

        assertThat(relationTypeService.getTypesForRelation("r1"))
                .extracting(RelationTypeResponse::getId)
                .containsExactly("t1", "t2");
    }

    @Test
    void deleteRelationTypeFailsForUnknownId() {
        when(relationTypeRepository.existsById("t9")).thenReturn(false);

        assertThatThrownBy(() -> relationTypeService.deleteRelationType("t9"))
                .isInstanceOf(RelationTypeNotFoundException.class);
        verify(relationTypeRepository, never()).deleteById(any());
    }
}
