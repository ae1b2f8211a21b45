package com.eainde.augury.extraction;

import com.eainde.augury.conversation.ConversationStage;
import com.eainde.augury.theory.UserInput;

import java.util.Map;

/**
 * Used when no chat model is configured: the deterministic validators are the only source of fields.
 */
public class DeterministicOnlyExtractor implements FieldExtractor {

    @Override
    public Map<String, Object> extract(ConversationStage stage, String text, UserInput known) {
        return Map.of();
    }
}
