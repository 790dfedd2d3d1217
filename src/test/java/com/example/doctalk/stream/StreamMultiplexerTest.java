package com.example.doctalk.stream;

import com.example.doctalk.model.Citation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamMultiplexerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StreamMultiplexer multiplexer = new StreamMultiplexer(objectMapper);

    @Test
    void multiplex_tokensThenSourcesBlock() throws Exception {
        List<Citation> citations = List.of(Citation.of("a.pdf", 0.912, "Either party may terminate"));

        String body = String.join("", multiplexer.multiplex(Flux.just("Hel", "", "lo"), citations)
                .collectList().block());

        assertThat(body).startsWith("Hello" + StreamMultiplexer.SOURCES_SENTINEL);
        String json = body.substring(("Hello" + StreamMultiplexer.SOURCES_SENTINEL).length());
        List<Citation> parsed = objectMapper.readValue(json, new TypeReference<List<Citation>>() {
        });
        assertThat(parsed).containsExactly(new Citation("a.pdf", "91.2", "Either party may terminate"));
    }

    @Test
    void multiplex_noCitations_noSentinel() {
        StepVerifier.create(multiplexer.multiplex(Flux.just("Hello"), List.of()))
                .expectNext("Hello")
                .verifyComplete();
    }

    @Test
    void multiplex_tokenError_noSourcesBlock() {
        StepVerifier.create(multiplexer.multiplex(
                        Flux.concat(Flux.just("Hel"), Flux.error(new IllegalStateException("boom"))),
                        List.of(Citation.of("a.pdf", 0.5, "p"))))
                .expectNext("Hel")
                .verifyError(IllegalStateException.class);
    }
}
