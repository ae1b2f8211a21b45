package com.eainde.augury.conversation;

/**
 * @param maxRetries failed turns per stage before examples are shown and skippable fields are auto-skipped
 * @param maxHistory history entries kept per session
 */
public record ConversationSettings(int maxRetries, int maxHistory) {

    public ConversationSettings {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
    }

    public static ConversationSettings defaults() {
        return new ConversationSettings(3, 100);
    }
}
