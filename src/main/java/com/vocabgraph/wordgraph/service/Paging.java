package com.vocabgraph.wordgraph.service;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

final class Paging {

    static final int MAX_PAGE_SIZE = 100;

    private Paging() {
    }

    static PageRequest byId(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative, got " + page);
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE + ", got " + size);
        }
        return PageRequest.of(page, size, Sort.by("id"));
    }
}
