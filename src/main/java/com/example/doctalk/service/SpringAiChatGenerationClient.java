package com.example.doctalk.service;

import com.example.doctalk.model.ChatMessage;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChatGenerationClient} backed by a Spring AI {@link ChatClient}.
 * Messages go in as a ready-made {@link Prompt} so braces in evidence text are not parsed as
 * template placeholders.
 */
public class SpringAiChatGenerationClient implements ChatGenerationClient {

    private final ChatClient chatClient;

    public SpringAiChatGenerationClient(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String complete(String systemPrompt, List<ChatMessage> messages) {
        return chatClient.prompt(toPrompt(systemPrompt, messages))
                .call()
                .content();
    }

    @Override
    public Flux<String> stream(String systemPrompt, List<ChatMessage> messages) {
        return chatClient.prompt(toPrompt(systemPrompt, messages))
                .stream()
                .content();
    }

    static Prompt toPrompt(String systemPrompt, List<ChatMessage> messages) {
        List<Message> springMessages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            springMessages.add(new SystemMessage(systemPrompt));
        }
        for (ChatMessage m : messages) {
            if (m == null || m.safeContent().isBlank()) {
                continue;
            }
            if (m.isAssistant()) {
                springMessages.add(new AssistantMessage(m.content()));
            } else {
                springMessages.add(new UserMessage(m.content()));
            }
        }
        return new Prompt(springMessages);
    }
}
