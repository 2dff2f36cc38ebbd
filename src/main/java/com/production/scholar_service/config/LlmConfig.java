package com.production.scholar_service.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@Slf4j
public class LlmConfig {

    @Bean
    @ConditionalOnProperty(prefix = "scholar.llm", name = "provider", havingValue = "ollama", matchIfMissing = true)
    ChatLanguageModel ollamaChatModel(AppConfig appConfig) {
        AppConfig.Llm llm = appConfig.getLlm();
        log.info("Using Ollama chat model '{}' at {}", llm.getOllama().getChatModel(), llm.getOllama().getBaseUrl());
        return OllamaChatModel.builder()
                .baseUrl(llm.getOllama().getBaseUrl())
                .modelName(llm.getOllama().getChatModel())
                .temperature(0.2)
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "scholar.llm", name = "provider", havingValue = "openai")
    ChatLanguageModel openAiChatModel(AppConfig appConfig) {
        AppConfig.Llm llm = appConfig.getLlm();
        log.info("Using OpenAI chat model '{}'", llm.getOpenai().getChatModel());
        return OpenAiChatModel.builder()
                .apiKey(llm.getOpenai().getApiKey())
                .modelName(llm.getOpenai().getChatModel())
                .temperature(0.2)
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .build();
    }
}
