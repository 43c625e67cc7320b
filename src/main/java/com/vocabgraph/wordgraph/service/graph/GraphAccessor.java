package com.vocabgraph.wordgraph.service.graph;

import com.vocabgraph.wordgraph.dto.graph.AdjacentEdge;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read-only view of the word/relation store shaped for traversal.
 *
 * Implementations must be safe for concurrent use; traversals share one accessor
 * and keep all per-request state on their own stack.
 */
public interface GraphAccessor {

    /**
     * Relations incident to a word, in both directions.
     * A relation where the word is the source yields an OUTGOING edge to the target;
     * one where it is the target yields an INCOMING edge to the source.
     *
     * @return edges ordered by relation id, empty if the word has no relations
     * @throws com.vocabgraph.wordgraph.exception.WordNotFoundException if the word does not exist
     * @throws com.vocabgraph.wordgraph.exception.StoreUnavailableException if the store read fails
     */
    List<AdjacentEdge> adjacency(String wordId);

    /**
     * @throws com.vocabgraph.wordgraph.exception.StoreUnavailableException if the store read fails
     */
    boolean wordExists(String wordId);

    /**
     * Subset of the given ids that still exist in the store.
     *
     * @throws com.vocabgraph.wordgraph.exception.StoreUnavailableException if the store read fails
     */
    Set<String> existingWordIds(Collection<String> wordIds);
}
