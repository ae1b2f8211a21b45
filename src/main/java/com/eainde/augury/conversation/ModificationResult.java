package com.eainde.augury.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param field       modified field
 * @param oldValue    previous value, null when the field was unset or skipped
 * @param newValue    normalized new value
 * @param invalidated cached theories requeued for recomputation
 * @param stage       stage of the session, unchanged by the modification
 */
public record ModificationResult(
        @JsonProperty("field")       String field,
        @JsonProperty("old_value")   Object oldValue,
        @JsonProperty("new_value")   Object newValue,
        @JsonProperty("invalidated") List<String> invalidated,
        @JsonProperty("stage")       ConversationStage stage
) {

    public ModificationResult {
        invalidated = List.copyOf(invalidated);
    }

    public String describe() {
        String base = "Updated " + field.replace('_', ' ') + " to " + newValue + ".";
        if (invalidated.isEmpty()) {
            return base;
        }
        return base + " " + invalidated.size() + " reading(s) will be recalculated: " + String.join(", ", invalidated) + ".";
    }
}
