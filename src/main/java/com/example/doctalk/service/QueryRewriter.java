package com.example.doctalk.service;

import com.example.doctalk.config.ChatProperties;
import com.example.doctalk.model.ChatMessage;
import com.example.doctalk.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Turns the tail of a conversation into one standalone search query.
 * <p>
 * Rewriting only improves retrieval; every failure path returns the user's last message as-is.
 */
@Service
public class QueryRewriter {

    private static final Logger log = LoggerFactory.getLogger(QueryRewriter.class);

    static final String SYSTEM_PROMPT = """
            You are a search query optimizer.
            1. Rewrite the LAST user message into a standalone search query by resolving pronouns (e.g. "it", "that file") using the history.
            2. If the user's message is purely conversational, return it as is.
            3. DO NOT answer the question. ONLY return the query string.""";

    /** Anything longer is an answer, not a query. */
    static final int MAX_QUERY_LENGTH = 500;

    private final ChatGenerationClient generationClient;
    private final ChatProperties chatProperties;

    public QueryRewriter(@Qualifier("rewriteGenerationClient") ChatGenerationClient generationClient,
                         ChatProperties chatProperties) {
        this.generationClient = generationClient;
        this.chatProperties = chatProperties;
    }

    /**
     * @param history     visible conversation, oldest first, including the last message
     * @param lastMessage the message to rewrite
     */
    public String rewrite(List<ChatMessage> history, String lastMessage) {
        if (history == null || history.size() <= 1) {
            return lastMessage;
        }

        List<ChatMessage> window = TextUtils.recent(history, chatProperties.getHistoryWindow());
        try {
            String raw = Mono.fromCallable(() -> generationClient.complete(SYSTEM_PROMPT, window))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(chatProperties.getRewriteTimeout())
                    .block();

            String query = clean(raw);
            if (query == null) {
                log.warn("Query synthesis returned unusable output, falling back to original query");
                return lastMessage;
            }
            log.debug("Query synthesis: '{}' -> '{}'", TextUtils.truncate(lastMessage, 80), TextUtils.truncate(query, 80));
            return query;
        } catch (RuntimeException e) {
            log.warn("Query synthesis failed, falling back to original query: {}", e.toString());
            return lastMessage;
        }
    }

    /**
     * Strip quoting and labels the model tends to add; null when nothing usable is left.
     */
    static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String query = raw.trim();
        if (query.regionMatches(true, 0, "query:", 0, 6)) {
            query = query.substring(6).trim();
        }
        if (query.length() >= 2 && query.startsWith("\"") && query.endsWith("\"")) {
            query = query.substring(1, query.length() - 1).trim();
        }
        if (query.isEmpty() || query.length() > MAX_QUERY_LENGTH) {
            return null;
        }
        return query;
    }
}
