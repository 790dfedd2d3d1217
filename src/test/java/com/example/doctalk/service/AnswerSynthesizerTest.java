package com.example.doctalk.service;

import com.example.doctalk.config.ChatProperties;
import com.example.doctalk.exception.GenerationException;
import com.example.doctalk.model.ChatMessage;
import com.example.doctalk.model.DocumentRef;
import com.example.doctalk.model.EntitySummary;
import com.example.doctalk.model.EvidenceBundle;
import com.example.doctalk.model.EvidenceChunk;
import com.example.doctalk.model.GraphFact;
import com.example.doctalk.persona.Persona;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerSynthesizerTest {

    @Mock
    private ChatGenerationClient generationClient;

    private ChatProperties chatProperties;
    private AnswerSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        chatProperties = new ChatProperties();
        synthesizer = new AnswerSynthesizer(generationClient, chatProperties);
    }

    @Test
    void buildSystemPrompt_rendersPersonaAndAllSections() {
        EvidenceBundle bundle = new EvidenceBundle("acme",
                List.of(new EvidenceChunk("Either party may terminate with 30 days notice.", "contract.pdf", 0.9)),
                List.of(new GraphFact("Acme", "ORG", "PARTY_TO", "Supply Agreement", "CONTRACT")),
                List.of(new EntitySummary("Acme", "ORG", 7)),
                List.of(new DocumentRef("contract.pdf", Instant.parse("2024-03-01T09:30:00Z"))),
                List.of());

        String prompt = synthesizer.buildSystemPrompt(Persona.LEGAL, bundle);

        assertThat(prompt).startsWith(Persona.LEGAL.promptFragment());
        assertThat(prompt).contains("Cite source filenames in brackets");
        assertThat(prompt).contains(AnswerSynthesizer.DOCUMENTS_HEADER + "\n- contract.pdf (Uploaded: 2024-03-01)");
        assertThat(prompt).contains("Acme (ORG) - 7 connections");
        assertThat(prompt).contains("RELATIONSHIP: \"Acme\" (ORG) -> [PARTY_TO] -> \"Supply Agreement\" (CONTRACT)");
        assertThat(prompt).contains("SOURCE: contract.pdf\nEither party may terminate with 30 days notice.");
        assertThat(prompt).contains("cannot find the information");
    }

    @Test
    void buildSystemPrompt_emptySections_usePlaceholders() {
        String prompt = synthesizer.buildSystemPrompt(Persona.GENERAL, EvidenceBundle.empty("q"));

        assertThat(prompt).contains("No documents uploaded yet.");
        assertThat(prompt).contains("No global graph data available.");
        assertThat(prompt).contains("No direct entity relationships found for this query.");
        assertThat(prompt).contains("No specific content chunks found matching this query.");
    }

    @Test
    void synthesize_relaysTokensAndSendsRecentHistoryOnly() {
        chatProperties.setHistoryWindow(2);
        List<ChatMessage> history = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            history.add(ChatMessage.user("message " + i));
        }
        when(generationClient.stream(anyString(), anyList())).thenReturn(Flux.just("Hel", "lo"));

        StepVerifier.create(synthesizer.synthesize(Persona.GENERAL, EvidenceBundle.empty("q"), history))
                .expectNext("Hel", "lo")
                .verifyComplete();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatMessage>> sent = ArgumentCaptor.forClass(List.class);
        verify(generationClient).stream(anyString(), sent.capture());
        assertThat(sent.getValue()).extracting(ChatMessage::content).containsExactly("message 3", "message 4");
    }

    @Test
    void synthesize_deadlinePasses_failsWithTimeoutMessage() {
        chatProperties.setGenerationTimeout(Duration.ofMillis(100));
        when(generationClient.stream(anyString(), anyList())).thenReturn(Flux.never());

        StepVerifier.create(synthesizer.synthesize(Persona.GENERAL, EvidenceBundle.empty("q"),
                        List.of(ChatMessage.user("hi"))))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(GenerationException.class)
                        .hasMessageContaining("took too long"))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void synthesize_providerError_hidesProviderMessage() {
        when(generationClient.stream(anyString(), eq(List.of(ChatMessage.user("hi")))))
                .thenReturn(Flux.error(new IllegalStateException("401 invalid api key sk-123")));

        StepVerifier.create(synthesizer.synthesize(Persona.GENERAL, EvidenceBundle.empty("q"),
                        List.of(ChatMessage.user("hi"))))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(GenerationException.class)
                        .hasMessage("Failed to generate an answer. Please try again."))
                .verify();
    }

    @Test
    void synthesize_cancelled_cancelsModelCall() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(generationClient.stream(anyString(), anyList()))
                .thenReturn(Flux.<String>never().doOnCancel(() -> cancelled.set(true)));

        StepVerifier.create(synthesizer.synthesize(Persona.GENERAL, EvidenceBundle.empty("q"),
                        List.of(ChatMessage.user("hi"))))
                .thenCancel()
                .verify();

        assertThat(cancelled).isTrue();
    }
}
