package com.eainde.augury.theory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Life domain a question belongs to. The key is what {@link FieldNames#QUESTION_CATEGORY} stores.
 */
public enum QuestionCategory {

    CAREER("career", List.of("career", "job", "work", "promotion", "boss", "business", "office", "interview", "resign")),
    WEALTH("wealth", List.of("wealth", "money", "finance", "invest", "investment", "salary", "income", "stock", "debt", "fortune")),
    LOVE("love", List.of("love", "romance", "crush", "boyfriend", "girlfriend", "dating", "partner", "breakup")),
    MARRIAGE("marriage", List.of("marriage", "marry", "wedding", "spouse", "husband", "wife", "divorce")),
    HEALTH("health", List.of("health", "illness", "sick", "disease", "surgery", "recovery", "doctor")),
    STUDY("study", List.of("study", "exam", "school", "university", "degree", "test", "course", "learning")),
    RELATIONSHIP("relationship", List.of("relationship", "friend", "friends", "colleague", "family", "parents", "social")),
    TIMING("timing", List.of("timing", "when", "date", "schedule", "moment", "best day")),
    DECISION("decision", List.of("decision", "decide", "choose", "choice", "should i", "whether", "option")),
    PERSONALITY("personality", List.of("personality", "character traits", "temperament", "who am i")),
    OTHER("other", List.of());

    private final String key;
    private final List<String> keywords;

    QuestionCategory(String key, List<String> keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    public String key() {
        return key;
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * Resolves a stored category key; unknown keys map to {@link #OTHER}.
     */
    public static QuestionCategory fromKey(String key) {
        if (key == null) {
            return OTHER;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.key.equals(normalized))
                .findFirst()
                .orElse(OTHER);
    }

    /**
     * Finds the category whose keywords occur most often in free text.
     * Returns empty when nothing matches or two categories tie.
     */
    public static Optional<QuestionCategory> detect(String text) {
        List<QuestionCategory> best = candidates(text);
        return best.size() == 1 ? Optional.of(best.get(0)) : Optional.empty();
    }

    /**
     * Categories sharing the highest keyword count in the text; empty when nothing matches.
     */
    public static List<QuestionCategory> candidates(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = " " + text.toLowerCase(Locale.ROOT).replaceAll("[^a-z ]", " ") + " ";
        List<QuestionCategory> best = new ArrayList<>();
        int bestHits = 0;
        for (QuestionCategory category : values()) {
            int hits = 0;
            for (String keyword : category.keywords) {
                if (lower.contains(" " + keyword + " ")) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                best.clear();
                best.add(category);
                bestHits = hits;
            } else if (hits > 0 && hits == bestHits) {
                best.add(category);
            }
        }
        return List.copyOf(best);
    }
}
