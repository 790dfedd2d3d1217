package com.example.doctalk.model;

import jakarta.validation.constraints.NotBlank;

/**
 * One conversation turn as sent by the client.
 *
 * @param role    "user" or "assistant"
 * @param content message text
 */
public record ChatMessage(
        @NotBlank String role,
        String content
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ROLE_ASSISTANT, content);
    }

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equalsIgnoreCase(role);
    }

    public String safeContent() {
        return content == null ? "" : content;
    }
}
