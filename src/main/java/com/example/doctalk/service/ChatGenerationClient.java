package com.example.doctalk.service;

import com.example.doctalk.model.ChatMessage;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Text generation as consumed by the chat pipeline. The system prompt is sent verbatim,
 * never treated as a template.
 */
public interface ChatGenerationClient {

    /**
     * One blocking completion.
     */
    String complete(String systemPrompt, List<ChatMessage> messages);

    /**
     * Streamed completion; cancelling the subscription cancels the upstream call.
     */
    Flux<String> stream(String systemPrompt, List<ChatMessage> messages);
}
