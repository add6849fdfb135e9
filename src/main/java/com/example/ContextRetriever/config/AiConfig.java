package com.example.ContextRetriever.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiConfig {

    static final String CLASSIFIER_SYSTEM_PROMPT =
            "You are a context-aware retrieval router. You never answer the user's question; "
                    + "you only decide where its answer should be retrieved from.";

    /**
     * Reasoning client used by the strategy classifier.
     * DeepSeek is preferred when its model is configured, otherwise OpenAI is used,
     * so a missing API key for one provider does not stop the app from starting.
     */
    @Bean
    public ChatClient strategyChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel)
                    .defaultSystem(CLASSIFIER_SYSTEM_PROMPT)
                    .build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel)
                    .defaultSystem(CLASSIFIER_SYSTEM_PROMPT)
                    .build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }
}
