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
import com.example.doctalk.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the answer prompt from a persona and an evidence bundle and streams the model's reply.
 */
@Service
public class AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final String DOCUMENTS_HEADER = "AVAILABLE DOCUMENTS (User's Workspace):";
    static final String ENTITIES_HEADER = "KEY CONCEPTS (Most Connected Entities):";
    static final String FACTS_HEADER = "SPECIFIC CONNECTIONS (Query-Related):";
    static final String CHUNKS_HEADER = "TEXT CONTEXT:";

    private static final DateTimeFormatter UPLOAD_DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final ChatGenerationClient generationClient;
    private final ChatProperties chatProperties;

    public AnswerSynthesizer(@Qualifier("answerGenerationClient") ChatGenerationClient generationClient,
                             ChatProperties chatProperties) {
        this.generationClient = generationClient;
        this.chatProperties = chatProperties;
    }

    /**
     * Stream the answer. The stream fails with {@link GenerationException} when the model call
     * fails or the configured deadline passes; cancelling it cancels the model call.
     */
    public Flux<String> synthesize(Persona persona, EvidenceBundle bundle, List<ChatMessage> history) {
        String systemPrompt = buildSystemPrompt(persona, bundle);
        List<ChatMessage> window = TextUtils.recent(history, chatProperties.getHistoryWindow());
        Duration timeout = chatProperties.getGenerationTimeout();

        Mono<Object> deadline = Mono.delay(timeout)
                .then(Mono.error(() -> new GenerationException(
                        "The answer took too long to generate. Please try again.")));

        return Flux.defer(() -> generationClient.stream(systemPrompt, window))
                .takeUntilOther(deadline)
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException("Failed to generate an answer. Please try again.", e))
                .doOnError(e -> log.error("Answer generation failed for persona {}", persona.id(), e));
    }

    public String buildSystemPrompt(Persona persona, EvidenceBundle bundle) {
        return persona.promptFragment() + "\n\n"
                + """
                CORE RESPONSIBILITIES:
                1. Answer primarily based on the provided CONTEXT (Text & Graph).
                2. Cite source filenames in brackets in your answer (e.g. [Filename.pdf]).
                3. Use the KNOWLEDGE GRAPH sections to explain relationships.
                4. If the context does not contain the answer, say that you cannot find the information in the user's documents. Do not make up facts.
                """
                + "\n" + DOCUMENTS_HEADER + "\n" + renderDocuments(bundle.documents()) + "\n"
                + "\n" + ENTITIES_HEADER + "\n" + renderEntities(bundle.entities()) + "\n"
                + "\n" + FACTS_HEADER + "\n" + renderFacts(bundle.facts()) + "\n"
                + "\n" + CHUNKS_HEADER + "\n" + renderChunks(bundle.chunks()) + "\n"
                + """

                STYLE GUIDELINES:
                - If the user asks "What is this workspace about?", use the "KEY CONCEPTS" section.
                - If the user asks "What did I upload?", use the "AVAILABLE DOCUMENTS" section (note the dates).
                - CHECK THE CONVERSATION HISTORY for user preferences (e.g. "be concise").""";
    }

    private static String renderDocuments(List<DocumentRef> documents) {
        if (documents.isEmpty()) {
            return "No documents uploaded yet.";
        }
        return documents.stream()
                .map(d -> "- " + d.filename()
                        + (d.uploadedAt() != null ? " (Uploaded: " + UPLOAD_DATE.format(d.uploadedAt()) + ")" : ""))
                .collect(Collectors.joining("\n"));
    }

    private static String renderEntities(List<EntitySummary> entities) {
        if (entities.isEmpty()) {
            return "No global graph data available.";
        }
        return entities.stream()
                .map(e -> e.label() + " (" + e.type() + ") - " + e.degree() + " connections")
                .collect(Collectors.joining(", "));
    }

    private static String renderFacts(List<GraphFact> facts) {
        if (facts.isEmpty()) {
            return "No direct entity relationships found for this query.";
        }
        return facts.stream()
                .map(f -> "RELATIONSHIP: \"" + f.subject() + "\" (" + f.subjectType() + ") -> ["
                        + f.relationship() + "] -> \"" + f.object() + "\" (" + f.objectType() + ")")
                .collect(Collectors.joining("\n"));
    }

    private static String renderChunks(List<EvidenceChunk> chunks) {
        if (chunks.isEmpty()) {
            return "No specific content chunks found matching this query.";
        }
        return chunks.stream()
                .map(c -> "SOURCE: " + c.sourceDocument() + "\n" + c.text())
                .collect(Collectors.joining("\n\n---\n\n"));
    }
}
