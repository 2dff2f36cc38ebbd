package com.production.scholar_service.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@Slf4j
public class EmbeddingConfig {

    @Bean
    @ConditionalOnProperty(prefix = "scholar.llm", name = "provider", havingValue = "ollama", matchIfMissing = true)
    EmbeddingModel ollamaEmbeddingModel(AppConfig appConfig) {
        AppConfig.Llm llm = appConfig.getLlm();
        log.info("Using Ollama embedding model '{}'", llm.getOllama().getEmbeddingModel());
        return OllamaEmbeddingModel.builder()
                .baseUrl(llm.getOllama().getBaseUrl())
                .modelName(llm.getOllama().getEmbeddingModel())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "scholar.llm", name = "provider", havingValue = "openai")
    EmbeddingModel openAiEmbeddingModel(AppConfig appConfig) {
        AppConfig.Llm llm = appConfig.getLlm();
        log.info("Using OpenAI embedding model '{}' with {} dimensions",
                llm.getOpenai().getEmbeddingModel(), appConfig.getEmbedding().getDimensions());
        return OpenAiEmbeddingModel.builder()
                .apiKey(llm.getOpenai().getApiKey())
                .modelName(llm.getOpenai().getEmbeddingModel())
                .dimensions(appConfig.getEmbedding().getDimensions())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .build();
    }
}
