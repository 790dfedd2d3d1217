package com.example.doctalk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Chat pipeline settings, bound from {@code app.chat.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.chat")
public class ChatProperties {

    /** Most recent messages passed to the rewriter and the answer model. */
    private int historyWindow = 10;

    /** Total deadline for one streamed answer. */
    private Duration generationTimeout = Duration.ofSeconds(30);

    /** Backstop for the whole HTTP response, rewrite and retrieval included. */
    private Duration responseTimeout = Duration.ofSeconds(60);

    /** Deadline for the query rewrite call. */
    private Duration rewriteTimeout = Duration.ofSeconds(5);

    /** Sent instead of calling the model when no evidence source returned anything. */
    private String noEvidenceAnswer = "I couldn't find any relevant information in your documents. "
            + "Try uploading a document first or rephrasing your question.";
}
