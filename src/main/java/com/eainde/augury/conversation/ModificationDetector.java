package com.eainde.augury.conversation;

import com.eainde.augury.theory.FieldNames;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Spots explicit change requests in free text, e.g. "change my birth year to 1991" or
 * "actually my birth month is 5".
 */
@Component
public class ModificationDetector {

    private static final Map<String, String> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("birth year", FieldNames.BIRTH_YEAR);
        ALIASES.put("year of birth", FieldNames.BIRTH_YEAR);
        ALIASES.put("birth month", FieldNames.BIRTH_MONTH);
        ALIASES.put("month of birth", FieldNames.BIRTH_MONTH);
        ALIASES.put("birth day", FieldNames.BIRTH_DAY);
        ALIASES.put("day of birth", FieldNames.BIRTH_DAY);
        ALIASES.put("birth hour", FieldNames.BIRTH_HOUR);
        ALIASES.put("birth time", FieldNames.BIRTH_HOUR);
        ALIASES.put("hour of birth", FieldNames.BIRTH_HOUR);
        ALIASES.put("gender", FieldNames.GENDER);
        ALIASES.put("personality type", FieldNames.PERSONALITY_TYPE);
        ALIASES.put("mbti type", FieldNames.PERSONALITY_TYPE);
        ALIASES.put("mbti", FieldNames.PERSONALITY_TYPE);
        ALIASES.put("favorite color", FieldNames.FAVORITE_COLOR);
        ALIASES.put("favourite colour", FieldNames.FAVORITE_COLOR);
        ALIASES.put("favourite color", FieldNames.FAVORITE_COLOR);
        ALIASES.put("favorite colour", FieldNames.FAVORITE_COLOR);
        ALIASES.put("current direction", FieldNames.CURRENT_DIRECTION);
        ALIASES.put("facing direction", FieldNames.CURRENT_DIRECTION);
        ALIASES.put("question description", FieldNames.QUESTION_DESCRIPTION);
        ALIASES.put("description", FieldNames.QUESTION_DESCRIPTION);
        ALIASES.put("seed character", FieldNames.CHARACTER);
        ALIASES.put("character", FieldNames.CHARACTER);
        ALIASES.put("lucky numbers", FieldNames.NUMBERS);
        ALIASES.put("numbers", FieldNames.NUMBERS);
        ALIASES.put("question category", FieldNames.QUESTION_CATEGORY);
        ALIASES.put("category", FieldNames.QUESTION_CATEGORY);
        ALIASES.put("birth time certainty", FieldNames.BIRTH_TIME_CERTAINTY);
    }

    private static final String FIELD = ALIASES.keySet().stream()
            .sorted((a, b) -> b.length() - a.length())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

    private static final Pattern CHANGE = Pattern.compile(
            "\\b(?:change|update|correct|modify|set)\\s+(?:my\\s+|the\\s+)?(" + FIELD + ")\\s+(?:to|as|into)\\s+(.+)$");
    private static final Pattern ACTUALLY = Pattern.compile(
            "\\bactually,?\\s+(?:my\\s+|the\\s+)?(" + FIELD + ")\\s+(?:is|was|should be)\\s+(.+)$");
    private static final Pattern SHOULD_BE = Pattern.compile(
            "\\bmy\\s+(" + FIELD + ")\\s+should be\\s+(.+)$");

    public Optional<FieldModification> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.trim().toLowerCase(Locale.ROOT);
        for (Pattern pattern : new Pattern[]{CHANGE, ACTUALLY, SHOULD_BE}) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                String field = ALIASES.get(matcher.group(1));
                // Value keeps the user's casing, e.g. a seed character or an MBTI code
                String value = text.trim().substring(matcher.start(2)).replaceAll("[.!?]+$", "").trim();
                return Optional.of(new FieldModification(field, value));
            }
        }
        return Optional.empty();
    }
}
