package com.vocabgraph.wordgraph.controller;

import com.vocabgraph.wordgraph.dto.CreateRelationRequest;
import com.vocabgraph.wordgraph.dto.RelationResponse;
import com.vocabgraph.wordgraph.exception.GlobalExceptionHandler;
import com.vocabgraph.wordgraph.exception.RelationNotFoundException;
import com.vocabgraph.wordgraph.model.RelationCategory;
import com.vocabgraph.wordgraph.model.RelationType;
import com.vocabgraph.wordgraph.service.RelationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class RelationControllerTest {

    @Mock
    private RelationService relationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RelationController(relationService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createRelationReturnsCreated() throws Exception {
        when(relationService.createRelation(any(CreateRelationRequest.class))).thenReturn(RelationResponse.builder()
                .id("r1")
                .sourceWordId("big")
                .targetWordId("large")
                .strength(0.9)
                .relationType(RelationType.SYNONYM)
                .relationCategory(RelationCategory.SEMANTIC)
                .build());

        mockMvc.perform(post("/api/relations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceWordId\":\"big\",\"targetWordId\":\"large\","
                                + "\"strength\":0.9,\"relationType\":\"SYNONYM\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("r1"))
                .andExpect(jsonPath("$.relationCategory").value("SEMANTIC"));
    }

    @Test
    void strengthAboveOneFailsValidation() throws Exception {
        mockMvc.perform(post("/api/relations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceWordId\":\"big\",\"targetWordId\":\"large\",\"strength\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Strength must be between 0 and 1"));
        verifyNoInteractions(relationService);
    }

    @Test
    void deleteUnknownRelationIsNotFound() throws Exception {
        doThrow(new RelationNotFoundException("Relation not found with id: r9"))
                .when(relationService).deleteRelation("r9");

        mockMvc.perform(delete("/api/relations/r9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void betweenListsDirectRelations() throws Exception {
        when(relationService.getRelationsBetween("big", "large"))
                .thenReturn(List.of(RelationResponse.builder().id("r1").build()));

        mockMvc.perform(get("/api/relations/between").param("sourceId", "big").param("targetId", "large"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("r1"));
    }
}
