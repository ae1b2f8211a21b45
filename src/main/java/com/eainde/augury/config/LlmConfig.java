package com.eainde.augury.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Chat model for extraction and report Q&A. Without an API key no model bean exists and both
 * fall back to their deterministic paths.
 */
@Log4j2
@Configuration
public class LlmConfig {

    @Bean
    @ConditionalOnProperty(prefix = "augury.llm.openai", name = "api-key")
    public ChatModel chatModel(@Value("${augury.llm.openai.api-key}") String apiKey,
                               @Value("${augury.llm.openai.model-name:gpt-4o-mini}") String modelName,
                               @Value("${augury.llm.openai.temperature:0.0}") Double temperature,
                               @Value("${augury.llm.openai.timeout:30s}") Duration timeout) {
        log.info("Building OpenAI chat model {}", modelName);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(timeout)
                .listeners(List.of(new LlmObservabilityListener()))
                .build();
    }
}
