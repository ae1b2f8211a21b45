package com.eainde.augury.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

public record HistoryEntry(
        @JsonProperty("role") Role role,
        @JsonProperty("text") String text,
        @JsonProperty("at")   Instant at
) implements Serializable {

    public enum Role { USER, SYSTEM }
}
