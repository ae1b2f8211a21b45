package com.eainde.augury.arbitration;

import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryNames;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Confidence rules and arbitrator priority lists of {@link ArbitrationSystem}.
 *
 * @param matchBonus                added to the matched side's confidence
 * @param matchConfidenceFloor      the matched side's confidence is raised to at least this
 * @param inconclusiveConfidenceCap confidence ceiling when the arbitrator matches neither side
 * @param consensusBonus            added to the mean confidence when it matches both sides
 * @param priorities                ranked arbitrators per category
 * @param defaultPriority           ranked arbitrators for categories without their own list
 */
public record ArbitrationSettings(
        double matchBonus,
        double matchConfidenceFloor,
        double inconclusiveConfidenceCap,
        double consensusBonus,
        Map<QuestionCategory, List<String>> priorities,
        List<String> defaultPriority
) {

    public ArbitrationSettings {
        requireUnit("matchBonus", matchBonus);
        requireUnit("matchConfidenceFloor", matchConfidenceFloor);
        requireUnit("inconclusiveConfidenceCap", inconclusiveConfidenceCap);
        requireUnit("consensusBonus", consensusBonus);
        EnumMap<QuestionCategory, List<String>> copy = new EnumMap<>(QuestionCategory.class);
        priorities.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        priorities = Collections.unmodifiableMap(copy);
        defaultPriority = List.copyOf(defaultPriority);
    }

    public List<String> priorityFor(QuestionCategory category) {
        return priorities.getOrDefault(category, defaultPriority);
    }

    public static ArbitrationSettings defaults() {
        return withConfidence(0.10, 0.75, 0.50, 0.10);
    }

    /** Built-in priority lists with the given confidence rules. */
    public static ArbitrationSettings withConfidence(double matchBonus, double matchConfidenceFloor,
                                                     double inconclusiveConfidenceCap, double consensusBonus) {
        Map<QuestionCategory, List<String>> priorities = new EnumMap<>(QuestionCategory.class);
        priorities.put(QuestionCategory.CAREER,
                List.of(TheoryNames.LIUYAO, TheoryNames.MEIHUA, TheoryNames.XIAOLIU, TheoryNames.QIMEN));
        priorities.put(QuestionCategory.LOVE,
                List.of(TheoryNames.CEZI, TheoryNames.MEIHUA, TheoryNames.LIUYAO, TheoryNames.ZIWEI));
        priorities.put(QuestionCategory.WEALTH,
                List.of(TheoryNames.LIUYAO, TheoryNames.QIMEN, TheoryNames.XIAOLIU, TheoryNames.MEIHUA));
        priorities.put(QuestionCategory.HEALTH,
                List.of(TheoryNames.LIUYAO, TheoryNames.XIAOLIU, TheoryNames.MEIHUA, TheoryNames.BAZI));
        priorities.put(QuestionCategory.DECISION,
                List.of(TheoryNames.QIMEN, TheoryNames.LIUYAO, TheoryNames.DALIUREN, TheoryNames.MEIHUA));
        priorities.put(QuestionCategory.STUDY,
                List.of(TheoryNames.MEIHUA, TheoryNames.LIUYAO, TheoryNames.BAZI, TheoryNames.ZIWEI));
        List<String> fallback = List.of(TheoryNames.LIUYAO, TheoryNames.MEIHUA, TheoryNames.XIAOLIU, TheoryNames.QIMEN);
        return new ArbitrationSettings(matchBonus, matchConfidenceFloor, inconclusiveConfidenceCap, consensusBonus,
                priorities, fallback);
    }

    private static void requireUnit(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1], was " + value);
        }
    }
}
