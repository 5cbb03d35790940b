package com.task.tablescan.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Vision chat model used as an OCR backend. Only created when OPENAI_API_KEY is set.
 */
@Configuration
public class LangchainConfig {

    @Bean
    @ConditionalOnProperty(name = "OPENAI_API_KEY")
    public ChatModel visionChatModel(
            @Value("${OPENAI_API_KEY}") String apiKey,
            @Value("${OPENAI_MODEL:gpt-4o}") String modelName
    ) {
        if (apiKey.isBlank()) {
            throw new IllegalStateException("OPENAI_API_KEY environment variable must be non-empty");
        }
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(0.0)
                .maxTokens(4000)
                .timeout(Duration.ofSeconds(120))
                .build();
    }
}
