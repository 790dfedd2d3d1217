package com.example.doctalk.config;

import com.example.doctalk.service.ChatGenerationClient;
import com.example.doctalk.service.SpringAiChatGenerationClient;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class AiConfig {

    /**
     * Client for the streamed answers.
     * DeepSeek is used when its chat model is active ({@code spring.ai.model.chat=deepseek}),
     * otherwise OpenAI.
     */
    @Bean
    @Primary
    public ChatClient answerChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel).build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel).build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }

    /**
     * Client for query rewriting: a small, fast OpenAI model when OpenAI is configured,
     * otherwise the answer model.
     */
    @Bean
    public ChatClient rewriteChatClient(
            ObjectProvider<OpenAiChatModel> openAiProvider,
            @Qualifier("answerChatClient") ChatClient answerChatClient,
            @Value("${app.ai.rewrite-model:gpt-4o-mini}") String rewriteModel
    ) {
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel == null) {
            return answerChatClient;
        }
        return ChatClient.builder(openAiModel)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(rewriteModel)
                        .temperature(0.0)
                        .build())
                .build();
    }

    @Bean
    public ChatGenerationClient answerGenerationClient(@Qualifier("answerChatClient") ChatClient chatClient) {
        return new SpringAiChatGenerationClient(chatClient);
    }

    @Bean
    public ChatGenerationClient rewriteGenerationClient(@Qualifier("rewriteChatClient") ChatClient chatClient) {
        return new SpringAiChatGenerationClient(chatClient);
    }
}
