package com.wellbridge.ai.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * A small model for assessment and classification, a larger one for everything the patient reads.
 * The classifier runs at temperature zero with a short context so its JSON verdicts stay stable;
 * the answer model gets room for record excerpts and prior turns.
 */
@Configuration
public class ChatClientConfig {

    @Bean(name = "classifierChatClient")
    public ChatClient classifierChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.classifier:llama3.2:3b}") String model,
            @Value("${app.models.classifier-temperature:0.0}") double temperature,
            @Value("${app.models.classifier-context:2048}") int contextWindow,
            @Value("${app.models.keep-alive:5m}") String keepAlive) {
        return ChatClient.builder(chatModel)
                .defaultOptions(options(model, temperature, contextWindow, keepAlive))
                .build();
    }

    @Bean(name = "answerChatClient")
    public ChatClient answerChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.answer:mistral:7b-instruct}") String model,
            @Value("${app.models.answer-temperature:0.3}") double temperature,
            @Value("${app.models.answer-context:8192}") int contextWindow,
            @Value("${app.models.keep-alive:5m}") String keepAlive) {
        return ChatClient.builder(chatModel)
                .defaultOptions(options(model, temperature, contextWindow, keepAlive))
                .build();
    }

    static OllamaChatOptions options(String model, double temperature, int contextWindow, String keepAlive) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model name is required");
        }
        if (contextWindow < 512) {
            throw new IllegalArgumentException("Context window too small for " + model + ": " + contextWindow);
        }
        return OllamaChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .numCtx(contextWindow)
                .keepAlive(keepAlive)
                .build();
    }
}
