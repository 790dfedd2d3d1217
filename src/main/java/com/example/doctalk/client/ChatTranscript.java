package com.example.doctalk.client;

import com.example.doctalk.exception.DocTalkException;
import com.example.doctalk.model.ChatMessage;
import com.example.doctalk.model.Citation;
import com.example.doctalk.stream.AnswerEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Client-side conversation state. While an answer streams in, the last entry is a growing
 * assistant placeholder; a failed or empty answer removes it again.
 */
public class ChatTranscript {

    private final List<ChatMessage> messages = new ArrayList<>();
    private final List<Citation> lastCitations = new ArrayList<>();
    private StringBuilder pending;
    private String errorMessage;

    public void addUserMessage(String content) {
        messages.add(ChatMessage.user(content));
    }

    public List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<Citation> lastCitations() {
        return Collections.unmodifiableList(lastCitations);
    }

    public String errorMessage() {
        return errorMessage;
    }

    /**
     * Drains an answer stream into the transcript.
     *
     * @return true when a non-empty answer was recorded
     */
    public boolean consume(Iterator<AnswerEvent> events) {
        errorMessage = null;
        lastCitations.clear();
        pending = new StringBuilder();
        messages.add(ChatMessage.assistant(""));

        try {
            while (events.hasNext()) {
                AnswerEvent event = events.next();
                if (event instanceof AnswerEvent.TextDelta delta) {
                    pending.append(delta.text());
                    replacePlaceholder(pending.toString());
                } else if (event instanceof AnswerEvent.Completed completed) {
                    lastCitations.addAll(completed.citations());
                }
            }
        } catch (DocTalkException e) {
            rollback(e.getMessage());
            return false;
        }

        if (pending.toString().isBlank()) {
            rollback("No response received.");
            return false;
        }
        pending = null;
        return true;
    }

    private void replacePlaceholder(String content) {
        messages.set(messages.size() - 1, ChatMessage.assistant(content));
    }

    private void rollback(String message) {
        messages.remove(messages.size() - 1);
        lastCitations.clear();
        pending = null;
        errorMessage = message;
    }
}
