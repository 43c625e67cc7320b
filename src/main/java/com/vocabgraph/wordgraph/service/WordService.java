package com.vocabgraph.wordgraph.service;

import com.vocabgraph.wordgraph.dto.CreateWordRequest;
import com.vocabgraph.wordgraph.dto.WordResponse;
import com.vocabgraph.wordgraph.exception.DuplicateWordException;
import com.vocabgraph.wordgraph.exception.WordNotFoundException;
import com.vocabgraph.wordgraph.model.Word;
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

@Service
@RequiredArgsConstructor
@Slf4j
public class WordService {

    private final WordRepository wordRepository;
    private final WordRelationRepository wordRelationRepository;
    private final RelationTypeDefinitionRepository relationTypeRepository;

    public WordResponse createWord(CreateWordRequest request) {
        String text = request.getWord().trim();
        String normalized = Word.normalize(text);
        log.info("Creating word: {} (normalized: {})", text, normalized);

        if (wordRepository.existsByNormalizedWord(normalized)) {
            throw new DuplicateWordException("Word already exists: " + normalized);
        }

        Word word = Word.builder()
                .word(text)
                .normalizedWord(normalized)
                .length(text.length())
                .frequencyRank(request.getFrequencyRank())
                .common(request.getCommon() == null || request.getCommon())
                .etymology(request.getEtymology())
                .description(request.getDescription() != null ? request.getDescription() : "")
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();

        Word saved = wordRepository.save(word);
        log.info("Word created successfully with id: {}", saved.getId());

        return mapToResponse(saved);
    }

    public WordResponse getWordById(String id) {
        log.info("Fetching word with id: {}", id);

        Word word = wordRepository.findById(id)
                .orElseThrow(() -> new WordNotFoundException("Word not found with id: " + id));

        return mapToResponse(word);
    }

    public WordResponse getWordByText(String text) {
        String normalized = Word.normalize(text);
        log.info("Looking up word: {}", normalized);

        Word word = wordRepository.findByNormalizedWord(normalized)
                .orElseThrow(() -> new WordNotFoundException("Word not found: " + normalized));

        return mapToResponse(word);
    }

    public List<WordResponse> listWords(int page, int size) {
        log.info("Listing words - page: {}, size: {}", page, size);

        return wordRepository.findAll(Paging.byId(page, size)).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    /**
     * Delete a word together with every relation it takes part in and their type records.
     */
    public void deleteWord(String id) {
        log.info("Deleting word with id: {}", id);

        if (!wordRepository.existsById(id)) {
            throw new WordNotFoundException("Word not found with id: " + id);
        }

        List<String> relationIds = wordRelationRepository.findBySourceWordIdOrTargetWordId(id, id).stream()
                .map(WordRelation::getId)
                .collect(Collectors.toList());
        if (!relationIds.isEmpty()) {
            relationTypeRepository.deleteByRelationIdIn(relationIds);
        }
        long removedRelations = wordRelationRepository.deleteBySourceWordIdOrTargetWordId(id, id);
        wordRepository.deleteById(id);

        log.info("Word {} deleted along with {} relations", id, removedRelations);
    }

    private WordResponse mapToResponse(Word word) {
        return WordResponse.builder()
                .id(word.getId())
                .word(word.getWord())
                .normalizedWord(word.getNormalizedWord())
                .length(word.getLength())
                .frequencyRank(word.getFrequencyRank())
                .common(word.isCommon())
                .etymology(word.getEtymology())
                .description(word.getDescription())
                .createdAt(word.getCreatedAt())
                .updatedAt(word.getUpdatedAt())
                .build();
    }
}
