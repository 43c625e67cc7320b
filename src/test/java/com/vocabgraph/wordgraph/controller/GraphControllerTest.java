package com.vocabgraph.wordgraph.controller;

import com.vocabgraph.wordgraph.dto.graph.NeighborhoodMetadata;
import com.vocabgraph.wordgraph.dto.graph.NeighborhoodResponse;
import com.vocabgraph.wordgraph.dto.graph.WordPath;
import com.vocabgraph.wordgraph.exception.GlobalExceptionHandler;
import com.vocabgraph.wordgraph.exception.InvalidTraversalArgumentException;
import com.vocabgraph.wordgraph.exception.StoreUnavailableException;
import com.vocabgraph.wordgraph.exception.WordNotFoundException;
import com.vocabgraph.wordgraph.service.graph.NeighborhoodService;
import com.vocabgraph.wordgraph.service.graph.PathFinderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class GraphControllerTest {

    @Mock
    private PathFinderService pathFinderService;

    @Mock
    private NeighborhoodService neighborhoodService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new GraphController(pathFinderService, neighborhoodService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void pathsUsesDefaultBounds() throws Exception {
        when(pathFinderService.findPaths("A", "C", 10, 1, 10)).thenReturn(List.of(WordPath.builder()
                .path(List.of("A", "B", "C"))
                .relations(List.of("r1", "r2"))
                .length(2)
                .totalStrength(0.63)
                .build()));

        mockMvc.perform(get("/api/graph/paths").param("sourceId", "A").param("targetId", "C"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].path[1]").value("B"))
                .andExpect(jsonPath("$[0].relations.length()").value(2))
                .andExpect(jsonPath("$[0].length").value(2))
                .andExpect(jsonPath("$[0].totalStrength").value(0.63));
    }

    @Test
    void pathsReturnsEmptyArrayWhenUnconnected() throws Exception {
        when(pathFinderService.findPaths("A", "Z", 5, 2, 4)).thenReturn(List.of());

        mockMvc.perform(get("/api/graph/paths")
                        .param("sourceId", "A")
                        .param("targetId", "Z")
                        .param("maxPaths", "5")
                        .param("minLength", "2")
                        .param("maxLength", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void invalidBoundsMapToBadRequest() throws Exception {
        when(pathFinderService.findPaths("A", "C", 10, 1, 50))
                .thenThrow(new InvalidTraversalArgumentException("maxLength must not exceed 10, got 50"));

        mockMvc.perform(get("/api/graph/paths")
                        .param("sourceId", "A")
                        .param("targetId", "C")
                        .param("maxLength", "50"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("maxLength must not exceed 10, got 50"));
    }

    @Test
    void missingSourceIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/graph/paths").param("targetId", "C"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required parameter: sourceId"));
        verifyNoInteractions(pathFinderService);
    }

    @Test
    void nonNumericBoundIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/graph/paths")
                        .param("sourceId", "A")
                        .param("targetId", "C")
                        .param("maxPaths", "many"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(pathFinderService);
    }

    @Test
    void unknownWordIsNotFound() throws Exception {
        when(pathFinderService.findPaths("X", "C", 10, 1, 10))
                .thenThrow(new WordNotFoundException("Word not found with id: X"));

        mockMvc.perform(get("/api/graph/paths").param("sourceId", "X").param("targetId", "C"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    void neighborhoodUsesDefaultBounds() throws Exception {
        when(neighborhoodService.getNeighborhood("A", 3, 100, 0)).thenReturn(NeighborhoodResponse.builder()
                .centerId("A")
                .nodeIds(List.of("A"))
                .edges(List.of())
                .metadata(NeighborhoodMetadata.builder().nodeCount(1).maxLevel(3).maxNodes(100).build())
                .build());

        mockMvc.perform(get("/api/graph/neighborhood/A"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.centerId").value("A"))
                .andExpect(jsonPath("$.nodeIds[0]").value("A"))
                .andExpect(jsonPath("$.metadata.truncated").value(false));

        verify(neighborhoodService).getNeighborhood("A", 3, 100, 0);
    }

    @Test
    void storeFailureIsServiceUnavailable() throws Exception {
        when(neighborhoodService.getNeighborhood(eq("A"), anyInt(), anyInt(), anyInt()))
                .thenThrow(new StoreUnavailableException("Failed to load relations for word: A",
                        new DataAccessResourceFailureException("down")));

        mockMvc.perform(get("/api/graph/neighborhood/A").param("maxLevel", "2"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }
}
