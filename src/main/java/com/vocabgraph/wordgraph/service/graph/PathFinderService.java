package com.vocabgraph.wordgraph.service.graph;

import com.vocabgraph.wordgraph.dto.graph.AdjacentEdge;
import com.vocabgraph.wordgraph.dto.graph.TraversalLimits;
import com.vocabgraph.wordgraph.dto.graph.WordPath;
import com.vocabgraph.wordgraph.exception.InvalidTraversalArgumentException;
import com.vocabgraph.wordgraph.exception.WordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Enumerates simple paths between two words, breadth-first.
 *
 * Partial paths wait in a FIFO queue, so shorter paths are found first. A path is never extended
 * through a word it already contains, and never beyond maxLength hops, which keeps the search finite
 * on cyclic graphs. Relations are usable in either direction; parallel relations between the same pair
 * of words produce distinct paths. Which paths are returned under the maxPaths cap follows the accessor's
 * adjacency order. A word deleted while the search runs is dropped like a stale relation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PathFinderService {

    private final GraphAccessor graphAccessor;
    private final TraversalLimits traversalLimits;

    /**
     * Find up to maxPaths simple paths from source to target with a hop count in [minLength, maxLength].
     *
     * @return found paths in discovery order; empty when none exist within bounds
     * @throws InvalidTraversalArgumentException if the bounds are malformed or above the configured ceilings
     * @throws WordNotFoundException if either word does not exist
     */
    public List<WordPath> findPaths(String sourceId, String targetId, int maxPaths, int minLength, int maxLength) {
        log.info("Finding paths from {} to {} - maxPaths: {}, length: {}..{}",
                sourceId, targetId, maxPaths, minLength, maxLength);

        validateBounds(maxPaths, minLength, maxLength);

        if (!graphAccessor.wordExists(sourceId)) {
            throw new WordNotFoundException("Word not found with id: " + sourceId);
        }
        if (!graphAccessor.wordExists(targetId)) {
            throw new WordNotFoundException("Word not found with id: " + targetId);
        }

        if (sourceId.equals(targetId)) {
            List<WordPath> result = new ArrayList<>();
            if (minLength <= 0) {
                result.add(PartialPath.start(sourceId).toWordPath());
            }
            return result;
        }

        List<WordPath> found = new ArrayList<>();
        Deque<PartialPath> queue = new ArrayDeque<>();
        queue.add(PartialPath.start(sourceId));
        int expanded = 0;

        search:
        while (!queue.isEmpty()) {
            PartialPath current = queue.poll();
            if (current.length() >= maxLength) {
                continue;
            }

            List<AdjacentEdge> adjacency;
            try {
                adjacency = graphAccessor.adjacency(current.wordId());
            } catch (WordNotFoundException e) {
                if (current.parent() == null) {
                    throw e;
                }
                // Deleted after it was reached; treated like a stale relation
                log.debug("Word {} disappeared during the search, dropping partial path", current.wordId());
                continue;
            }
            Set<String> liveNeighbors = graphAccessor.existingWordIds(adjacency.stream()
                    .map(AdjacentEdge::getNeighborId)
                    .collect(Collectors.toSet()));
            expanded++;

            for (AdjacentEdge edge : adjacency) {
                String next = edge.getNeighborId();
                if (current.contains(next) || !liveNeighbors.contains(next)) {
                    continue;
                }

                PartialPath extended = current.extend(edge);
                if (next.equals(targetId)) {
                    if (extended.length() >= minLength) {
                        found.add(extended.toWordPath());
                        if (found.size() >= maxPaths) {
                            break search;
                        }
                    }
                } else if (extended.length() < maxLength) {
                    queue.add(extended);
                }
            }
        }

        log.info("Found {} paths from {} to {} after expanding {} partial paths", found.size(), sourceId, targetId, expanded);
        return found;
    }

    private void validateBounds(int maxPaths, int minLength, int maxLength) {
        if (maxPaths <= 0) {
            throw new InvalidTraversalArgumentException("maxPaths must be positive, got " + maxPaths);
        }
        if (minLength < 0) {
            throw new InvalidTraversalArgumentException("minLength must not be negative, got " + minLength);
        }
        if (maxLength < minLength) {
            throw new InvalidTraversalArgumentException(
                    "maxLength (" + maxLength + ") must not be less than minLength (" + minLength + ")");
        }
        if (maxLength > traversalLimits.getMaxPathLength()) {
            throw new InvalidTraversalArgumentException(
                    "maxLength must not exceed " + traversalLimits.getMaxPathLength() + ", got " + maxLength);
        }
        if (maxPaths > traversalLimits.getMaxPaths()) {
            throw new InvalidTraversalArgumentException(
                    "maxPaths must not exceed " + traversalLimits.getMaxPaths() + ", got " + maxPaths);
        }
    }

    /**
     * Queue entry: the last hop of a path plus a link to the entry it extends.
     * Shared prefixes are stored once.
     */
    private record PartialPath(String wordId, String relationId, PartialPath parent, double strength, int length) {

        static PartialPath start(String wordId) {
            return new PartialPath(wordId, null, null, 1.0, 0);
        }

        PartialPath extend(AdjacentEdge edge) {
            return new PartialPath(edge.getNeighborId(), edge.getRelationId(), this,
                    strength * edge.getStrength(), length + 1);
        }

        boolean contains(String candidate) {
            for (PartialPath step = this; step != null; step = step.parent) {
                if (step.wordId.equals(candidate)) {
                    return true;
                }
            }
            return false;
        }

        WordPath toWordPath() {
            LinkedList<String> words = new LinkedList<>();
            LinkedList<String> relations = new LinkedList<>();
            for (PartialPath step = this; step != null; step = step.parent) {
                words.addFirst(step.wordId);
                if (step.relationId != null) {
                    relations.addFirst(step.relationId);
                }
            }
            return WordPath.builder()
                    .path(new ArrayList<>(words))
                    .relations(new ArrayList<>(relations))
                    .length(length)
                    .totalStrength(strength)
                    .build();
        }
    }
}
