package com.vocabgraph.wordgraph.config;

import com.vocabgraph.wordgraph.dto.graph.TraversalLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Hard ceilings for graph traversal requests.
 * Reads the limits from application.yml; request defaults are declared on the controller.
 */
@Configuration
@Slf4j
public class TraversalConfig {

    @Value("${wordgraph.traversal.max-path-length:10}")
    private int maxPathLength;

    @Value("${wordgraph.traversal.max-paths:100}")
    private int maxPaths;

    @Value("${wordgraph.traversal.max-level:5}")
    private int maxLevel;

    @Value("${wordgraph.traversal.max-nodes:500}")
    private int maxNodes;

    @Bean
    public TraversalLimits traversalLimits() {
        log.info("[Traversal Config] path length <= {}, paths <= {}, level <= {}, nodes <= {}",
                maxPathLength, maxPaths, maxLevel, maxNodes);

        return TraversalLimits.builder()
                .maxPathLength(maxPathLength)
                .maxPaths(maxPaths)
                .maxLevel(maxLevel)
                .maxNodes(maxNodes)
                .build();
    }
}
