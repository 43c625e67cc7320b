package com.vocabgraph.wordgraph.service.graph;

import com.vocabgraph.wordgraph.dto.graph.*;
import com.vocabgraph.wordgraph.exception.InvalidTraversalArgumentException;
import com.vocabgraph.wordgraph.exception.WordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Projects the bounded neighborhood of a word for graph display.
 *
 * Level-synchronous BFS from the center word. Relations are followed in both directions and each
 * edge is recorded in the direction it was walked (source = expanded word). An edge is dropped when
 * its reverse pair was already recorded, so a single relation is never shown twice. Note this also
 * hides a second, distinct relation that links the same two words the other way round.
 *
 * Expansion halts as soon as one more node would exceed maxNodes; the response is then flagged truncated.
 * A word deleted after it was reached stays in the result but is not expanded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NeighborhoodService {

    private final GraphAccessor graphAccessor;
    private final TraversalLimits traversalLimits;

    /**
     * Build the subgraph within maxLevel hops of a word.
     *
     * @param maxEdgesPerNode fan-out cap per expanded word; 0 means unbounded
     * @throws InvalidTraversalArgumentException if a bound is not positive (maxEdgesPerNode: negative)
     * @throws WordNotFoundException if the center word does not exist
     */
    public NeighborhoodResponse getNeighborhood(String wordId, int maxLevel, int maxNodes, int maxEdgesPerNode) {
        log.info("Building neighborhood for word: {}, maxLevel: {}, maxNodes: {}, maxEdgesPerNode: {}",
                wordId, maxLevel, maxNodes, maxEdgesPerNode);

        if (maxLevel <= 0) {
            throw new InvalidTraversalArgumentException("maxLevel must be positive, got " + maxLevel);
        }
        if (maxNodes <= 0) {
            throw new InvalidTraversalArgumentException("maxNodes must be positive, got " + maxNodes);
        }
        if (maxEdgesPerNode < 0) {
            throw new InvalidTraversalArgumentException("maxEdgesPerNode must not be negative, got " + maxEdgesPerNode);
        }
        int levelLimit = clamp("maxLevel", maxLevel, traversalLimits.getMaxLevel());
        int nodeLimit = clamp("maxNodes", maxNodes, traversalLimits.getMaxNodes());

        if (!graphAccessor.wordExists(wordId)) {
            throw new WordNotFoundException("Word not found with id: " + wordId);
        }

        Set<String> nodeIds = new LinkedHashSet<>();
        List<NeighborhoodEdge> edges = new ArrayList<>();
        Set<String> seenEdgeKeys = new HashSet<>();
        Map<String, Integer> discoveredAt = new HashMap<>();
        Deque<LevelEntry> queue = new ArrayDeque<>();
        boolean truncated = false;

        nodeIds.add(wordId);
        discoveredAt.put(wordId, 0);
        queue.add(new LevelEntry(wordId, 0));

        expansion:
        while (!queue.isEmpty()) {
            LevelEntry current = queue.poll();
            if (current.level() >= levelLimit) {
                continue;
            }

            List<AdjacentEdge> adjacency;
            try {
                adjacency = graphAccessor.adjacency(current.wordId());
            } catch (WordNotFoundException e) {
                if (current.level() == 0) {
                    throw e;
                }
                log.debug("Word {} disappeared during expansion, not expanding it", current.wordId());
                continue;
            }
            if (maxEdgesPerNode > 0 && adjacency.size() > maxEdgesPerNode) {
                adjacency = adjacency.subList(0, maxEdgesPerNode);
            }
            Set<String> liveNeighbors = graphAccessor.existingWordIds(adjacency.stream()
                    .map(AdjacentEdge::getNeighborId)
                    .collect(Collectors.toSet()));

            for (AdjacentEdge edge : adjacency) {
                String neighbor = edge.getNeighborId();
                if (!liveNeighbors.contains(neighbor)) {
                    log.debug("Skipping relation {} to missing word {}", edge.getRelationId(), neighbor);
                    continue;
                }
                if (neighbor.equals(current.wordId())) {
                    continue;
                }
                if (!nodeIds.contains(neighbor) && nodeIds.size() >= nodeLimit) {
                    truncated = true;
                    break expansion;
                }

                nodeIds.add(neighbor);
                if (!discoveredAt.containsKey(neighbor)) {
                    discoveredAt.put(neighbor, current.level() + 1);
                    queue.add(new LevelEntry(neighbor, current.level() + 1));
                }

                String edgeKey = current.wordId() + "->" + neighbor;
                String reverseEdgeKey = neighbor + "->" + current.wordId();
                if (seenEdgeKeys.contains(edgeKey) || seenEdgeKeys.contains(reverseEdgeKey)) {
                    continue;
                }
                seenEdgeKeys.add(edgeKey);
                edges.add(NeighborhoodEdge.builder()
                        .relationId(edge.getRelationId())
                        .source(current.wordId())
                        .target(neighbor)
                        .level(discoveredAt.get(neighbor))
                        .strength(edge.getStrength())
                        .relationType(edge.getRelationType())
                        .build());
            }
        }

        if (truncated) {
            log.info("Neighborhood of {} truncated at {} nodes", wordId, nodeLimit);
        }
        log.info("Neighborhood of {} has {} nodes and {} edges", wordId, nodeIds.size(), edges.size());

        return NeighborhoodResponse.builder()
                .centerId(wordId)
                .nodeIds(new ArrayList<>(nodeIds))
                .edges(edges)
                .metadata(NeighborhoodMetadata.builder()
                        .nodeCount(nodeIds.size())
                        .edgeCount(edges.size())
                        .maxLevel(levelLimit)
                        .maxNodes(nodeLimit)
                        .maxEdgesPerNode(maxEdgesPerNode)
                        .truncated(truncated)
                        .build())
                .build();
    }

    private int clamp(String name, int requested, int ceiling) {
        if (requested > ceiling) {
            log.debug("Clamping {} from {} to {}", name, requested, ceiling);
            return ceiling;
        }
        return requested;
    }

    private record LevelEntry(String wordId, int level) {}
}
