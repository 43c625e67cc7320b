package com.vocabgraph.wordgraph.repository;

import com.vocabgraph.wordgraph.model.RelationType;
import com.vocabgraph.wordgraph.model.WordRelation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WordRelationRepository extends MongoRepository<WordRelation, String> {

    // Adjacency lookups used by graph traversal
    List<WordRelation> findBySourceWordIdOrderByIdAsc(String sourceWordId);

    List<WordRelation> findByTargetWordIdOrderByIdAsc(String targetWordId);

    // Paged listings
    Page<WordRelation> findBySourceWordId(String sourceWordId, Pageable pageable);

    Page<WordRelation> findByTargetWordId(String targetWordId, Pageable pageable);

    @Query("{ '$or': [ { 'sourceWordId': ?0 }, { 'targetWordId': ?0 } ] }")
    Page<WordRelation> findByWordId(String wordId, Pageable pageable);

    List<WordRelation> findBySourceWordIdAndTargetWordId(String sourceWordId, String targetWordId);

    boolean existsBySourceWordIdAndTargetWordIdAndRelationType(String sourceWordId, String targetWordId,
                                                               RelationType relationType);

    List<WordRelation> findBySourceWordIdOrTargetWordId(String sourceWordId, String targetWordId);

    long deleteBySourceWordIdOrTargetWordId(String sourceWordId, String targetWordId);
}
