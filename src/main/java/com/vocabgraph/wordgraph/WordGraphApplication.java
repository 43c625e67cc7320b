package com.vocabgraph.wordgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WordGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordGraphApplication.class, args);
    }
}
