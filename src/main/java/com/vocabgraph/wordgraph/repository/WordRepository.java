package com.vocabgraph.wordgraph.repository;

import com.vocabgraph.wordgraph.model.Word;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WordRepository extends MongoRepository<Word, String> {

    Optional<Word> findByNormalizedWord(String normalizedWord);

    boolean existsByNormalizedWord(String normalizedWord);
}
