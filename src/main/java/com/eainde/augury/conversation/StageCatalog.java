package com.eainde.augury.conversation;

import com.eainde.augury.theory.FieldNames;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fields, prompts and examples of every stage that collects input.
 */
public final class StageCatalog {

    private StageCatalog() {
    }

    private static final Map<ConversationStage, List<StageRequirement>> REQUIREMENTS = new EnumMap<>(ConversationStage.class);
    private static final Map<ConversationStage, String> PROMPTS = new EnumMap<>(ConversationStage.class);
    private static final Map<ConversationStage, String> EXAMPLES = new EnumMap<>(ConversationStage.class);

    static {
        REQUIREMENTS.put(ConversationStage.ICEBREAK, List.of(
                StageRequirement.required(FieldNames.QUESTION_CATEGORY, "question category", FieldValidators.questionCategory()),
                StageRequirement.required(FieldNames.NUMBERS, "three numbers (1-9)", FieldValidators.numbers())));
        REQUIREMENTS.put(ConversationStage.DEEPEN, List.of(
                StageRequirement.required(FieldNames.QUESTION_DESCRIPTION, "situation description",
                        FieldValidators.questionDescription()),
                StageRequirement.skippable(FieldNames.CHARACTER, "one seed character", FieldValidators.character())));
        REQUIREMENTS.put(ConversationStage.COLLECT, List.of(
                StageRequirement.required(FieldNames.BIRTH_YEAR, "birth year", FieldValidators.birthYear()),
                StageRequirement.required(FieldNames.BIRTH_MONTH, "birth month", FieldValidators.birthMonth()),
                StageRequirement.required(FieldNames.BIRTH_DAY, "birth day", FieldValidators.birthDay()),
                StageRequirement.skippable(FieldNames.BIRTH_HOUR, "birth hour", FieldValidators.birthHour()),
                StageRequirement.required(FieldNames.GENDER, "gender", FieldValidators.gender()),
                StageRequirement.optional(FieldNames.PERSONALITY_TYPE, "MBTI type", FieldValidators.personalityType()),
                StageRequirement.optional(FieldNames.FAVORITE_COLOR, "favorite color", FieldValidators.favoriteColor()),
                StageRequirement.optional(FieldNames.CURRENT_DIRECTION, "direction you are facing",
                        FieldValidators.currentDirection()),
                StageRequirement.optional(FieldNames.BIRTH_TIME_CERTAINTY, "birth time certainty",
                        FieldValidators.birthTimeCertainty())));

        PROMPTS.put(ConversationStage.ICEBREAK,
                "Let's start simply. What area is your question about (career, wealth, love, health, study...)? "
                        + "And please give me three numbers between 1 and 9 that come to mind.");
        PROMPTS.put(ConversationStage.DEEPEN,
                "Tell me a little more about your situation. If you like, also give me one character that "
                        + "comes to mind (say \"skip\" if nothing does).");
        PROMPTS.put(ConversationStage.COLLECT,
                "For the deeper readings I need your birth date, birth hour (if you know it) and gender. "
                        + "Optionally: your MBTI type, favorite color and the direction you are facing.");
        PROMPTS.put(ConversationStage.VERIFY,
                "Before the final report, please answer three short questions about your past so I can "
                        + "calibrate the readings.");
        PROMPTS.put(ConversationStage.QA,
                "Ask me anything about the report, say \"report\" to see it again, or \"done\" to finish.");

        EXAMPLES.put(ConversationStage.ICEBREAK, "e.g. \"career, 3 7 2\"");
        EXAMPLES.put(ConversationStage.DEEPEN,
                "e.g. \"I have two job offers and cannot decide which to take. My character is 福\"");
        EXAMPLES.put(ConversationStage.COLLECT,
                "e.g. \"born 1990-05-12 around 14:30, female, INFJ, favorite color blue\"; "
                        + "say \"I don't know my birth hour\" to skip it");
    }

    public static List<StageRequirement> requirements(ConversationStage stage) {
        return REQUIREMENTS.getOrDefault(stage, List.of());
    }

    public static String prompt(ConversationStage stage) {
        return PROMPTS.getOrDefault(stage, "");
    }

    public static String example(ConversationStage stage) {
        return EXAMPLES.getOrDefault(stage, "");
    }

    /** Requirement for a field in any stage, used by explicit modifications. */
    public static Optional<StageRequirement> find(String field) {
        return REQUIREMENTS.values().stream()
                .flatMap(List::stream)
                .filter(r -> r.field().equals(field))
                .findFirst();
    }

    public static Optional<ConversationStage> stageOf(String field) {
        return REQUIREMENTS.entrySet().stream()
                .filter(e -> e.getValue().stream().anyMatch(r -> r.field().equals(field)))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
