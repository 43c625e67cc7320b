package com.vocabgraph.wordgraph.controller;

import com.vocabgraph.wordgraph.dto.CreateWordRequest;
import com.vocabgraph.wordgraph.dto.WordResponse;
import com.vocabgraph.wordgraph.service.WordService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/words")
@RequiredArgsConstructor
public class WordController {

    private final WordService wordService;

    @PostMapping
    public ResponseEntity<WordResponse> createWord(@Valid @RequestBody CreateWordRequest request) {
        WordResponse response = wordService.createWord(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<WordResponse> getWordById(@PathVariable String id) {
        WordResponse response = wordService.getWordById(id);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/lookup")
    public ResponseEntity<WordResponse> lookupWord(@RequestParam String text) {
        WordResponse response = wordService.getWordByText(text);
        return ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<List<WordResponse>> listWords(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        List<WordResponse> response = wordService.listWords(page, size);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteWord(@PathVariable String id) {
        wordService.deleteWord(id);
        return ResponseEntity.noContent().build();
    }
}
