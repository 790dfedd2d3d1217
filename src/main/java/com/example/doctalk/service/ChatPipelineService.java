package com.example.doctalk.service;

import com.example.doctalk.config.ChatProperties;
import com.example.doctalk.model.ChatAnswer;
import com.example.doctalk.model.ChatMessage;
import com.example.doctalk.model.EvidenceBundle;
import com.example.doctalk.model.RateDecision;
import com.example.doctalk.model.RateOperation;
import com.example.doctalk.persona.Persona;
import com.example.doctalk.persona.PersonaRegistry;
import com.example.doctalk.stream.StreamMultiplexer;
import com.example.doctalk.util.TextUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * The chat pipeline:
 *  admit → (rewrite query ∥ read persona) → fuse evidence → synthesize → multiplex sources.
 * <p>
 * Admission happens on the caller's thread so rejected requests never reach a model or a store.
 * Everything after it is deferred until the returned body is subscribed.
 */
@Service
@RequiredArgsConstructor
public class ChatPipelineService {

    private static final Logger log = LoggerFactory.getLogger(ChatPipelineService.class);

    private final RateGate rateGate;
    private final QueryRewriter queryRewriter;
    private final ContextFusionEngine contextFusionEngine;
    private final UserSettingsService userSettingsService;
    private final PersonaRegistry personaRegistry;
    private final AnswerSynthesizer answerSynthesizer;
    private final StreamMultiplexer streamMultiplexer;
    private final ChatProperties chatProperties;

    /**
     * @param messages visible conversation, oldest first; must not be empty
     * @throws com.example.doctalk.exception.RateLimitExceededException   chat budget spent
     * @throws com.example.doctalk.exception.RateGateUnavailableException counter store unreachable
     */
    public ChatAnswer answer(String userId, List<ChatMessage> messages) {
        RateDecision quota = rateGate.require(userId, RateOperation.CHAT);

        String lastMessage = messages.get(messages.size() - 1).safeContent();

        Mono<String> queryMono = Mono.fromCallable(() -> queryRewriter.rewrite(messages, lastMessage))
                .subscribeOn(Schedulers.boundedElastic());
        Mono<Persona> personaMono = Mono.fromCallable(() ->
                        personaRegistry.resolvePersona(userSettingsService.getActiveMode(userId)))
                .subscribeOn(Schedulers.boundedElastic());

        Flux<String> body = Mono.zip(queryMono, personaMono)
                .flatMapMany(t -> {
                    String query = t.getT1();
                    Persona persona = t.getT2();
                    return contextFusionEngine.fuse(query, userId)
                            .flatMapMany(bundle -> respond(userId, persona, bundle, messages));
                });

        return new ChatAnswer(quota, body);
    }

    private Flux<String> respond(String userId, Persona persona, EvidenceBundle bundle, List<ChatMessage> messages) {
        if (bundle.isEmpty()) {
            log.info("No evidence for user {} (query '{}'), answering with fallback",
                    userId, TextUtils.truncate(bundle.query(), 80));
            return Flux.just(chatProperties.getNoEvidenceAnswer());
        }
        return streamMultiplexer.multiplex(
                answerSynthesizer.synthesize(persona, bundle, messages),
                bundle.citations());
    }
}
