package com.example.doctalk.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request payload for POST /api/chat.
 *
 * @param messages full visible conversation, oldest first; the last entry is the question
 */
public record ChatRequest(
        @NotEmpty(message = "messages must not be empty")
        List<@Valid ChatMessage> messages
) {
    public ChatMessage lastMessage() {
        return messages.get(messages.size() - 1);
    }
}
