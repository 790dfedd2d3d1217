package com.example.doctalk.stream;

import com.example.doctalk.model.Citation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Server half of the answer framing: answer tokens verbatim, then
 * {@value #SOURCES_SENTINEL} followed by the citations as a JSON array.
 * No sentinel is written when there are no citations.
 */
@Component
@RequiredArgsConstructor
public class StreamMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(StreamMultiplexer.class);

    public static final String SOURCES_SENTINEL = "\n\n__SOURCES__:";

    private final ObjectMapper objectMapper;

    public Flux<String> multiplex(Flux<String> tokens, List<Citation> citations) {
        return tokens
                .filter(token -> !token.isEmpty())
                .concatWith(Mono.fromCallable(() -> sourcesBlock(citations)));
    }

    /**
     * @return the trailing block, or null when there is nothing to cite
     */
    String sourcesBlock(List<Citation> citations) {
        if (citations == null || citations.isEmpty()) {
            return null;
        }
        try {
            return SOURCES_SENTINEL + objectMapper.writeValueAsString(citations);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} citations, sending answer without sources", citations.size(), e);
            return null;
        }
    }
}
