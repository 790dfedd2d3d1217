package com.example.doctalk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Evidence lookup tuning, bound from {@code app.retrieval.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.retrieval")
public class RetrievalProperties {

    /** Max vector hits. */
    private int topK = 8;

    /** Chunks at or below this cosine similarity are dropped. */
    private double minScore = 0.1;

    /** Max graph edges matching the query. */
    private int relatedFactsLimit = 10;

    /** Max workspace-wide key entities. */
    private int topEntitiesLimit = 8;

    /** Per-source deadline; a slower source contributes nothing. */
    private Duration sourceTimeout = Duration.ofSeconds(5);

    /** Citation preview length, ellipsis included. */
    private int previewLength = 150;
}
