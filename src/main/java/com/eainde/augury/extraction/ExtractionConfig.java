package com.eainde.augury.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class ExtractionConfig {

    /**
     * Chat-model extraction when a model is configured, deterministic validators alone otherwise.
     * Either way every call is bounded by {@code augury.extraction.timeout}.
     */
    @Bean
    public FieldExtractor fieldExtractor(ObjectProvider<ChatModel> chatModel,
                                         ObjectMapper objectMapper,
                                         @Qualifier("extractionPool") Executor extractionPool,
                                         @Value("${augury.extraction.timeout:8s}") Duration timeout) {
        ChatModel model = chatModel.getIfAvailable();
        FieldExtractor delegate;
        if (model != null) {
            FieldExtractionAssistant assistant = AiServices.builder(FieldExtractionAssistant.class)
                    .chatModel(model)
                    .build();
            delegate = new LlmFieldExtractor(assistant, objectMapper);
            log.info("Field extraction backed by chat model, timeout {}", timeout);
        } else {
            delegate = new DeterministicOnlyExtractor();
            log.info("No chat model configured; field extraction is deterministic only");
        }
        return new TimedFieldExtractor(delegate, extractionPool, timeout);
    }
}
