package com.eainde.augury.extraction;

import com.eainde.augury.conversation.ConversationStage;
import com.eainde.augury.conversation.StageCatalog;
import com.eainde.augury.conversation.StageRequirement;
import com.eainde.augury.error.ExtractionParseException;
import com.eainde.augury.error.ExtractionProviderException;
import com.eainde.augury.theory.UserInput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extraction through a chat model. Only fields of the requested stage survive; values are
 * still validated by the Flow Guard before they are merged.
 */
@Slf4j
public class LlmFieldExtractor implements FieldExtractor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final FieldExtractionAssistant assistant;
    private final ObjectMapper objectMapper;

    public LlmFieldExtractor(FieldExtractionAssistant assistant, ObjectMapper objectMapper) {
        this.assistant = assistant;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, Object> extract(ConversationStage stage, String text, UserInput known) {
        List<String> wanted = StageCatalog.requirements(stage).stream().map(StageRequirement::field).toList();
        if (wanted.isEmpty()) {
            return Map.of();
        }

        String raw;
        try {
            raw = assistant.extract(stage.name(), String.join(", ", wanted), known.asMap().toString(), text);
        } catch (RuntimeException e) {
            throw new ExtractionProviderException(stage.name(), "Extraction call failed: " + e.getMessage(), e);
        }

        Map<String, Object> parsed;
        try {
            parsed = objectMapper.readValue(stripFences(raw), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ExtractionParseException(stage.name(), "Extraction returned invalid JSON", e);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        parsed.forEach((field, value) -> {
            if (value != null && wanted.contains(field)) {
                result.put(field, value);
            }
        });
        log.debug("Extracted {} field(s) for stage {}: {}", result.size(), stage, result.keySet());
        return result;
    }

    static String stripFences(String raw) {
        if (raw == null) {
            return "{}";
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                trimmed = trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed.isEmpty() ? "{}" : trimmed;
    }
}
