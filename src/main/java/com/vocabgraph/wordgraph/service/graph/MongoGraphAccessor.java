package com.vocabgraph.wordgraph.service.graph;

import com.vocabgraph.wordgraph.dto.graph.AdjacentEdge;
import com.vocabgraph.wordgraph.dto.graph.EdgeDirection;
import com.vocabgraph.wordgraph.exception.StoreUnavailableException;
import com.vocabgraph.wordgraph.exception.WordNotFoundException;
import com.vocabgraph.wordgraph.model.Word;
import com.vocabgraph.wordgraph.model.WordRelation;
import com.vocabgraph.wordgraph.repository.WordRelationRepository;
import com.vocabgraph.wordgraph.repository.WordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * {@link GraphAccessor} over the MongoDB word and relation collections.
 * Adjacency is sorted by relation id so traversal results are reproducible across calls.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoGraphAccessor implements GraphAccessor {

    private static final Comparator<AdjacentEdge> BY_RELATION_ID =
            Comparator.comparing(AdjacentEdge::getRelationId)
                    .thenComparing(AdjacentEdge::getDirection);

    private final WordRepository wordRepository;
    private final WordRelationRepository wordRelationRepository;

    @Override
    public List<AdjacentEdge> adjacency(String wordId) {
        try {
            if (!wordRepository.existsById(wordId)) {
                throw new WordNotFoundException("Word not found with id: " + wordId);
            }

            List<WordRelation> outgoing = wordRelationRepository.findBySourceWordIdOrderByIdAsc(wordId);
            List<WordRelation> incoming = wordRelationRepository.findByTargetWordIdOrderByIdAsc(wordId);

            List<AdjacentEdge> edges = new ArrayList<>(outgoing.size() + incoming.size());
            for (WordRelation relation : outgoing) {
                edges.add(toEdge(relation, relation.getTargetWordId(), EdgeDirection.OUTGOING));
            }
            for (WordRelation relation : incoming) {
                edges.add(toEdge(relation, relation.getSourceWordId(), EdgeDirection.INCOMING));
            }
            edges.sort(BY_RELATION_ID);

            log.debug("Adjacency for word {}: {} outgoing, {} incoming", wordId, outgoing.size(), incoming.size());
            return edges;
        } catch (DataAccessException dae) {
            log.error("DB error loading adjacency for word {}", wordId, dae);
            throw new StoreUnavailableException("Failed to load relations for word: " + wordId, dae);
        }
    }

    @Override
    public boolean wordExists(String wordId) {
        try {
            return wordRepository.existsById(wordId);
        } catch (DataAccessException dae) {
            log.error("DB error checking word {}", wordId, dae);
            throw new StoreUnavailableException("Failed to look up word: " + wordId, dae);
        }
    }

    @Override
    public Set<String> existingWordIds(Collection<String> wordIds) {
        if (wordIds.isEmpty()) {
            return Collections.emptySet();
        }
        try {
            Iterable<Word> words = wordRepository.findAllById(new HashSet<>(wordIds));
            return StreamSupport.stream(words.spliterator(), false)
                    .map(Word::getId)
                    .collect(Collectors.toSet());
        } catch (DataAccessException dae) {
            log.error("DB error checking {} words", wordIds.size(), dae);
            throw new StoreUnavailableException("Failed to look up words", dae);
        }
    }

    private AdjacentEdge toEdge(WordRelation relation, String neighborId, EdgeDirection direction) {
        return AdjacentEdge.builder()
                .neighborId(neighborId)
                .relationId(relation.getId())
                .direction(direction)
                .strength(relation.getStrength())
                .relationType(relation.getRelationType())
                .build();
    }
}
