package com.vocabgraph.wordgraph.controller;

import com.vocabgraph.wordgraph.dto.CreateRelationTypeRequest;
import com.vocabgraph.wordgraph.dto.RelationTypeResponse;
import com.vocabgraph.wordgraph.dto.UpdateRelationTypeRequest;
import com.vocabgraph.wordgraph.service.RelationTypeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Type records of relations, served next to the relation endpoints.
 */
@RestController
@RequestMapping("/api/relations")
@RequiredArgsConstructor
public class RelationTypeController {

    private final RelationTypeService relationTypeService;

    @PostMapping("/types")
    public ResponseEntity<RelationTypeResponse> createRelationType(@Valid @RequestBody CreateRelationTypeRequest request) {
        RelationTypeResponse response = relationTypeService.createRelationType(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @GetMapping("/types/{typeId}")
    public ResponseEntity<RelationTypeResponse> getRelationTypeById(@PathVariable String typeId) {
        return ResponseEntity.ok(relationTypeService.getRelationTypeById(typeId));
    }

    @PutMapping("/types/{typeId}")
    public ResponseEntity<RelationTypeResponse> updateRelationType(
            @PathVariable String typeId,
            @Valid @RequestBody UpdateRelationTypeRequest request) {
        return ResponseEntity.ok(relationTypeService.updateRelationType(typeId, request));
    }

    @DeleteMapping("/types/{typeId}")
    public ResponseEntity<Void> deleteRelationType(@PathVariable String typeId) {
        relationTypeService.deleteRelationType(typeId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{relationId}/types")
    public ResponseEntity<List<RelationTypeResponse>> getTypesForRelation(@PathVariable String relationId) {
        return ResponseEntity.ok(relationTypeService.getTypesForRelation(relationId));
    }
}
