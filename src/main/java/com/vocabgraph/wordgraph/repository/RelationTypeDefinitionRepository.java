package com.vocabgraph.wordgraph.repository;

import com.vocabgraph.wordgraph.model.RelationType;
import com.vocabgraph.wordgraph.model.RelationTypeDefinition;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RelationTypeDefinitionRepository extends MongoRepository<RelationTypeDefinition, String> {

    List<RelationTypeDefinition> findByRelationIdOrderByIdAsc(String relationId);

    boolean existsByRelationIdAndTypeName(String relationId, RelationType typeName);

    long deleteByRelationId(String relationId);

    long deleteByRelationIdIn(Collection<String> relationIds);
}
