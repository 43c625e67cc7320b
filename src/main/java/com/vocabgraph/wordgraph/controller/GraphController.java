package com.vocabgraph.wordgraph.controller;

import com.vocabgraph.wordgraph.dto.graph.NeighborhoodResponse;
import com.vocabgraph.wordgraph.dto.graph.WordPath;
import com.vocabgraph.wordgraph.service.graph.NeighborhoodService;
import com.vocabgraph.wordgraph.service.graph.PathFinderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for word graph traversal.
 */
@RestController
@RequestMapping("/api/graph")
@RequiredArgsConstructor
@Slf4j
public class GraphController {

    private final PathFinderService pathFinderService;
    private final NeighborhoodService neighborhoodService;

    /**
     * Find simple paths between two words.
     * An empty list means the words are not connected within the length bounds.
     *
     * @param maxPaths Maximum number of paths to return (default: 10)
     * @param minLength Minimum hop count (default: 1)
     * @param maxLength Maximum hop count (default: 10)
     */
    @GetMapping("/paths")
    public ResponseEntity<List<WordPath>> findPaths(
            @RequestParam String sourceId,
            @RequestParam String targetId,
            @RequestParam(defaultValue = "10") int maxPaths,
            @RequestParam(defaultValue = "1") int minLength,
            @RequestParam(defaultValue = "10") int maxLength) {
        log.info("Path request from {} to {}", sourceId, targetId);

        List<WordPath> response = pathFinderService.findPaths(sourceId, targetId, maxPaths, minLength, maxLength);
        return ResponseEntity.ok(response);
    }

    /**
     * Get the neighborhood subgraph around a word.
     *
     * @param maxLevel Maximum hop distance from the word (default: 3)
     * @param maxNodes Maximum number of distinct words (default: 100)
     * @param maxEdgesPerNode Relations followed per expanded word, 0 for all (default: 0)
     */
    @GetMapping("/neighborhood/{wordId}")
    public ResponseEntity<NeighborhoodResponse> getNeighborhood(
            @PathVariable String wordId,
            @RequestParam(defaultValue = "3") int maxLevel,
            @RequestParam(defaultValue = "100") int maxNodes,
            @RequestParam(defaultValue = "0") int maxEdgesPerNode) {
        log.info("Neighborhood request for word: {}", wordId);

        NeighborhoodResponse response = neighborhoodService.getNeighborhood(wordId, maxLevel, maxNodes, maxEdgesPerNode);
        return ResponseEntity.ok(response);
    }
}
