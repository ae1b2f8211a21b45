package com.eainde.augury.selection;

import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.TheoryTier;
import com.eainde.augury.theory.UserInput;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the subset of theories to run for a question and fixes their execution order.
 *
 * <pre>
 *   score every theory ─► drop ineligible / below threshold ─► top max_k by fitness
 *                                  │
 *                 fewer than min_k? retry with the fallback threshold
 *                                  │
 *          still short? attach the missing fields of the best ineligible theories
 *                                  │
 *                  reorder chosen theories by tier: FAST ─► BASIC ─► DEEP
 * </pre>
 *
 * <h3>Fitness</h3>
 * <ul>
 * <li><strong>completeness</strong> of the input for the theory, damped for birth-time sensitive
 *     theories when the birth time is uncertain (x0.8) or unknown (x0.3)</li>
 * <li><strong>affinity</strong>: cosine similarity between category and theory vectors</li>
 * <li><strong>personality</strong>: acceptance of the theory by the user's MBTI type, neutral if absent</li>
 * </ul>
 * Ineligible theories score 0. Ties keep declaration order.
 */
@Log4j2
@Component
public class TheorySelector {

    static final double UNCERTAIN_BIRTH_TIME_FACTOR = 0.8;
    static final double UNKNOWN_BIRTH_TIME_FACTOR = 0.3;

    private final SelectionSettings settings;
    private final AffinityProfile affinityProfile;

    public TheorySelector(SelectionSettings settings, AffinityProfile affinityProfile) {
        this.settings = settings;
        this.affinityProfile = affinityProfile;
    }

    /**
     * Selects with the configured limits.
     */
    public SelectionResult select(QuestionCategory category, UserInput input, TheoryRegistry registry) {
        return select(category, input, registry, settings.maxTheories(), settings.minTheories());
    }

    public SelectionResult select(QuestionCategory category, UserInput input, TheoryRegistry registry,
                                  int maxTheories, int minTheories) {
        if (maxTheories < 1 || minTheories < 0 || minTheories > maxTheories) {
            throw new IllegalArgumentException(
                    "Invalid selection bounds: max=" + maxTheories + ", min=" + minTheories);
        }

        List<TheoryFitness> ranking = rank(category, input, registry);

        List<TheoryFitness> chosen = choose(ranking, settings.primaryThreshold(), maxTheories);
        if (chosen.size() < minTheories) {
            log.debug("Only {} theories above {}, retrying with fallback threshold {}",
                    chosen.size(), settings.primaryThreshold(), settings.fallbackThreshold());
            chosen = choose(ranking, settings.fallbackThreshold(), maxTheories);
        }

        List<String> missing = chosen.size() < minTheories ? missingSuggestions(ranking, input) : List.of();
        if (!missing.isEmpty()) {
            log.info("Selected {} of required {} theories; missing fields {}", chosen.size(), minTheories, missing);
        }

        List<TheoryFitness> ordered = new ArrayList<>(chosen);
        // Stable sort keeps the fitness order inside one tier
        ordered.sort(Comparator.comparing(f -> f.descriptor().getTier()));

        List<TheoryDescriptor> selected = ordered.stream().map(TheoryFitness::descriptor).toList();
        List<String> reasons = ordered.stream().map(f -> reason(category, f)).toList();

        log.info("Selected theories {} for category {}", selected.stream().map(TheoryDescriptor::getName).toList(),
                category.key());
        return new SelectionResult(selected, ranking, missing, reasons);
    }

    /**
     * Scores every registered theory; best first, ties in declaration order.
     */
    public List<TheoryFitness> rank(QuestionCategory category, UserInput input, TheoryRegistry registry) {
        String personalityType = input.getString(FieldNames.PERSONALITY_TYPE).orElse(null);
        double certaintyFactor = birthTimeFactor(input);

        List<TheoryFitness> ranking = new ArrayList<>();
        for (TheoryDescriptor descriptor : registry.descriptors()) {
            double completeness = descriptor.completeness(input);
            double informationTerm = descriptor.isBirthTimeSensitive() ? completeness * certaintyFactor : completeness;
            double affinity = affinityProfile.categoryAffinity(category, descriptor.getName());
            double personality = affinityProfile.personalityScore(personalityType, descriptor.getName());
            boolean eligible = descriptor.isEligible(input);

            double raw = settings.completenessWeight() * informationTerm
                    + settings.affinityWeight() * affinity
                    + settings.personalityWeight() * personality;
            double potential = settings.completenessWeight()
                    + settings.affinityWeight() * affinity
                    + settings.personalityWeight() * personality;
            double fitness = eligible && completeness > 0.0 ? raw : 0.0;

            ranking.add(new TheoryFitness(descriptor, fitness, completeness, affinity, personality, eligible, potential));
        }
        // List.sort is stable: declaration order survives equal fitness
        ranking.sort(Comparator.comparingDouble(TheoryFitness::fitness).reversed());
        return ranking;
    }

    private List<TheoryFitness> choose(List<TheoryFitness> ranking, double threshold, int maxTheories) {
        List<TheoryFitness> candidates = ranking.stream()
                .filter(TheoryFitness::eligible)
                .filter(f -> f.fitness() > threshold)
                .toList();

        List<TheoryFitness> chosen = new ArrayList<>();
        if (settings.ensureTierCoverage()) {
            for (TheoryTier tier : TheoryTier.values()) {
                candidates.stream()
                        .filter(f -> f.descriptor().getTier() == tier)
                        .findFirst()
                        .filter(f -> chosen.size() < maxTheories)
                        .ifPresent(chosen::add);
            }
        }
        for (TheoryFitness candidate : candidates) {
            if (chosen.size() >= maxTheories) {
                break;
            }
            if (!chosen.contains(candidate)) {
                chosen.add(candidate);
            }
        }
        // Back to fitness order after the tier round
        chosen.sort(Comparator.comparingInt(candidates::indexOf));
        return chosen;
    }

    private List<String> missingSuggestions(List<TheoryFitness> ranking, UserInput input) {
        List<TheoryFitness> ineligible = new ArrayList<>(ranking.stream().filter(f -> !f.eligible()).toList());
        ineligible.sort(Comparator.comparingDouble(TheoryFitness::potential).reversed());

        Set<String> missing = new LinkedHashSet<>();
        for (TheoryFitness fitness : ineligible) {
            TheoryDescriptor descriptor = fitness.descriptor();
            List<String> required = descriptor.missingRequired(input).stream()
                    .filter(f -> !input.isSkipped(f))
                    .toList();
            if (!required.isEmpty()) {
                missing.addAll(required);
            } else if (descriptor.missingRequired(input).isEmpty()) {
                // Required fields present but completeness too low: the heaviest missing optional field helps most
                descriptor.getOptionalFields().stream()
                        .filter(f -> !input.isSettled(f))
                        .max(Comparator.comparingDouble(descriptor::weightOf))
                        .ifPresent(missing::add);
            }
        }
        return List.copyOf(missing);
    }

    private double birthTimeFactor(UserInput input) {
        String certainty = input.getString(FieldNames.BIRTH_TIME_CERTAINTY).orElse("certain").toLowerCase(Locale.ROOT);
        if (input.isSkipped(FieldNames.BIRTH_HOUR) || "unknown".equals(certainty)) {
            return UNKNOWN_BIRTH_TIME_FACTOR;
        }
        if ("uncertain".equals(certainty)) {
            return UNCERTAIN_BIRTH_TIME_FACTOR;
        }
        return 1.0;
    }

    private static String reason(QuestionCategory category, TheoryFitness fitness) {
        return String.format(Locale.ROOT, "%s: fitness %.2f (completeness %.2f, %s affinity %.2f)",
                fitness.descriptor().getDisplayName(), fitness.fitness(), fitness.completeness(),
                category.key(), fitness.affinity());
    }
}
