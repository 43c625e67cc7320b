package com.vocabgraph.wordgraph.controller;

import com.vocabgraph.wordgraph.dto.CreateRelationRequest;
import com.vocabgraph.wordgraph.dto.RelationResponse;
import com.vocabgraph.wordgraph.dto.UpdateRelationRequest;
import com.vocabgraph.wordgraph.service.RelationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/relations")
@RequiredArgsConstructor
public class RelationController {

    private final RelationService relationService;

    @PostMapping
    public ResponseEntity<RelationResponse> createRelation(@Valid @RequestBody CreateRelationRequest request) {
        RelationResponse response = relationService.createRelation(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<RelationResponse> getRelationById(@PathVariable String id) {
        RelationResponse response = relationService.getRelationById(id);
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{id}")
    public ResponseEntity<RelationResponse> updateRelation(
            @PathVariable String id,
            @Valid @RequestBody UpdateRelationRequest request) {
        RelationResponse response = relationService.updateRelation(id, request);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRelation(@PathVariable String id) {
        relationService.deleteRelation(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/word/{wordId}/outgoing")
    public ResponseEntity<List<RelationResponse>> getOutgoingRelations(
            @PathVariable String wordId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        return ResponseEntity.ok(relationService.getOutgoingRelations(wordId, page, size));
    }

    @GetMapping("/word/{wordId}/incoming")
    public ResponseEntity<List<RelationResponse>> getIncomingRelations(
            @PathVariable String wordId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        return ResponseEntity.ok(relationService.getIncomingRelations(wordId, page, size));
    }

    @GetMapping("/word/{wordId}/all")
    public ResponseEntity<List<RelationResponse>> getAllRelations(
            @PathVariable String wordId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        return ResponseEntity.ok(relationService.getAllRelations(wordId, page, size));
    }

    @GetMapping("/between")
    public ResponseEntity<List<RelationResponse>> getRelationsBetween(
            @RequestParam String sourceId,
            @RequestParam String targetId) {
        return ResponseEntity.ok(relationService.getRelationsBetween(sourceId, targetId));
    }
}
