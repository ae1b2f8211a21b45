package com.eainde.augury.conflict;

import com.eainde.augury.arbitration.ArbitrationOutcome;
import com.eainde.augury.error.ArbitrationUnavailableException;
import com.eainde.augury.error.InsufficientTheoriesException;
import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.TheoryResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Reconciles a complete set of theory results into one verdict.
 *
 * <pre>
 *   every pair (a,b) ─► Δ = |level_a - level_b| ─► tier
 *
 *     opposite sides of neutral, or Δ &gt; ε3  →  SEVERE
 *     Δ &gt; ε2                                →  SIGNIFICANT
 *     Δ &gt; ε1                                →  MINOR
 *     otherwise                             →  CONSISTENT
 *
 *   highest tier across all pairs ─► one global blend over all results
 *
 *     CONSISTENT  : confidence-weighted mode of judgments
 *     MINOR       : arithmetic mean of levels
 *     SIGNIFICANT : mean weighted by confidence^c
 *     SEVERE      : arbitration of the widest severe pair, else conservative fallback
 * </pre>
 *
 * <p>The resolver never sees a partial result set: callers join all theory runs first.
 * It is also the only blending path; revised confidences are resolved with the same call.</p>
 */
@Log4j2
@Component
public class ConflictResolver {

    private static final double NEUTRAL_LEVEL = Judgment.NEUTRAL.canonicalLevel();

    private final ConflictSettings settings;

    public ConflictResolver(ConflictSettings settings) {
        this.settings = settings;
    }

    public ConflictSettings settings() {
        return settings;
    }

    // =========================================================================
    //  Classification
    // =========================================================================

    /**
     * Tier of one pair. Symmetric in its arguments.
     */
    public ConflictTier classify(TheoryResult a, TheoryResult b) {
        double delta = Math.abs(a.level() - b.level());
        if (a.judgment().opposes(b.judgment()) || delta > settings.significantThreshold()) {
            return ConflictTier.SEVERE;
        }
        if (delta > settings.minorThreshold()) {
            return ConflictTier.SIGNIFICANT;
        }
        if (delta > settings.consistentThreshold()) {
            return ConflictTier.MINOR;
        }
        return ConflictTier.CONSISTENT;
    }

    public ConflictRecord compare(TheoryResult a, TheoryResult b) {
        return new ConflictRecord(a.theoryName(), b.theoryName(), Math.abs(a.level() - b.level()), classify(a, b), null);
    }

    // =========================================================================
    //  Resolution
    // =========================================================================

    /**
     * Resolves without arbitration; severe conflicts take the conservative fallback.
     */
    public ConflictResolution resolve(List<TheoryResult> results) {
        return resolve(results, null);
    }

    /**
     * @param results    complete, non-empty result set with distinct theory names
     * @param arbitrator consulted for severe conflicts; may be null
     * @throws InsufficientTheoriesException when {@code results} is empty
     */
    public ConflictResolution resolve(List<TheoryResult> results, Arbitrator arbitrator) {
        if (results == null || results.isEmpty()) {
            throw new InsufficientTheoriesException(List.of());
        }
        Set<String> names = new HashSet<>();
        for (TheoryResult result : results) {
            if (!names.add(result.theoryName())) {
                throw new IllegalArgumentException("Duplicate result for theory: " + result.theoryName());
            }
        }

        if (results.size() == 1) {
            TheoryResult only = results.get(0);
            return new ConflictResolution(BlendStrategy.SINGLE_RESULT, only.judgment(), only.level(), only.confidence(),
                    List.of(), ConflictTier.CONSISTENT, Map.of(), Map.of(only.theoryName(), 1.0), null,
                    List.of("Only one theory could be run; the verdict rests on a single reading."));
        }

        // ── STEP 1: classify every pair ──
        List<ConflictRecord> conflicts = new ArrayList<>();
        Map<ConflictTier, Integer> tierCounts = new EnumMap<>(ConflictTier.class);
        for (int i = 0; i < results.size(); i++) {
            for (int j = i + 1; j < results.size(); j++) {
                ConflictRecord record = compare(results.get(i), results.get(j));
                conflicts.add(record);
                tierCounts.merge(record.tier(), 1, Integer::sum);
            }
        }
        ConflictTier highest = conflicts.stream()
                .map(ConflictRecord::tier)
                .max(Comparator.comparingInt(ConflictTier::level))
                .orElse(ConflictTier.CONSISTENT);

        log.debug("Classified {} pairs, highest tier {}, counts {}", conflicts.size(), highest, tierCounts);

        // ── STEP 2: one global blend chosen by the highest tier ──
        ConflictResolution resolution = switch (highest) {
            case CONSISTENT -> consensusMode(results, conflicts, tierCounts);
            case MINOR -> simpleAverage(results, conflicts, tierCounts);
            case SIGNIFICANT -> confidenceWeighted(results, conflicts, tierCounts);
            case SEVERE -> severe(results, conflicts, tierCounts, arbitrator);
        };

        log.info("Resolved {} results with {}: {} (level {}, confidence {})", results.size(), resolution.strategy(),
                resolution.judgment(), round(resolution.level()), round(resolution.confidence()));
        return resolution;
    }

    private ConflictResolution consensusMode(List<TheoryResult> results, List<ConflictRecord> conflicts,
                                             Map<ConflictTier, Integer> tierCounts) {
        Map<Judgment, Double> support = new LinkedHashMap<>();
        results.forEach(r -> support.merge(r.judgment(), r.confidence(), Double::sum));

        Judgment mode = null;
        double best = -1.0;
        for (Map.Entry<Judgment, Double> entry : support.entrySet()) {
            if (entry.getValue() > best) {
                mode = entry.getKey();
                best = entry.getValue();
            }
        }

        Map<String, Double> weights = normalize(results, TheoryResult::confidence);
        double level = weightedLevel(results, weights);
        double confidence = mean(results.stream().mapToDouble(TheoryResult::confidence).toArray());
        return build(BlendStrategy.CONSENSUS_MODE, mode, level, confidence, conflicts, ConflictTier.CONSISTENT,
                tierCounts, weights, null);
    }

    private ConflictResolution simpleAverage(List<TheoryResult> results, List<ConflictRecord> conflicts,
                                             Map<ConflictTier, Integer> tierCounts) {
        Map<String, Double> weights = normalize(results, r -> 1.0);
        double level = mean(results.stream().mapToDouble(TheoryResult::level).toArray());
        double confidence = mean(results.stream().mapToDouble(TheoryResult::confidence).toArray());
        return build(BlendStrategy.SIMPLE_AVERAGE, Judgment.fromLevel(level), level, confidence, conflicts,
                ConflictTier.MINOR, tierCounts, weights, null);
    }

    private ConflictResolution confidenceWeighted(List<TheoryResult> results, List<ConflictRecord> conflicts,
                                                  Map<ConflictTier, Integer> tierCounts) {
        Map<String, Double> weights = boostedWeights(results);
        double level = weightedLevel(results, weights);
        double confidence = weightedConfidence(results, weights);
        return build(BlendStrategy.CONFIDENCE_WEIGHTED, Judgment.fromLevel(level), level, confidence, conflicts,
                ConflictTier.SIGNIFICANT, tierCounts, weights, null);
    }

    private ConflictResolution severe(List<TheoryResult> results, List<ConflictRecord> conflicts,
                                      Map<ConflictTier, Integer> tierCounts, Arbitrator arbitrator) {
        Map<String, Double> weights = boostedWeights(results);

        // The widest severe gap is the one worth an extra theory
        int target = 0;
        for (int i = 0; i < conflicts.size(); i++) {
            ConflictRecord candidate = conflicts.get(i);
            if (candidate.tier() == ConflictTier.SEVERE
                    && (conflicts.get(target).tier() != ConflictTier.SEVERE || candidate.delta() > conflicts.get(target).delta())) {
                target = i;
            }
        }
        ConflictRecord severePair = conflicts.get(target);

        if (arbitrator != null) {
            try {
                ArbitrationOutcome outcome = arbitrator.arbitrate(severePair,
                        find(results, severePair.theoryA()), find(results, severePair.theoryB()));
                List<ConflictRecord> withOutcome = new ArrayList<>(conflicts);
                withOutcome.set(target, severePair.withArbitration(outcome));
                return build(BlendStrategy.ARBITRATED, outcome.adoptedJudgment(), outcome.adoptedLevel(),
                        outcome.adjustedConfidence(), withOutcome, ConflictTier.SEVERE, tierCounts, weights, outcome);
            } catch (ArbitrationUnavailableException e) {
                log.debug("Arbitration unavailable for {} vs {}: {}", severePair.theoryA(), severePair.theoryB(),
                        e.getMessage());
            }
        }

        // Conservative fallback: keep only part of the weighted deviation from neutral
        double blended = weightedLevel(results, weights);
        double level = NEUTRAL_LEVEL + (blended - NEUTRAL_LEVEL) * settings.fallbackDampening();
        double confidence = Math.min(weightedConfidence(results, weights), settings.fallbackConfidenceCap());
        return build(BlendStrategy.CONSERVATIVE_FALLBACK, Judgment.fromLevel(level), level, confidence, conflicts,
                ConflictTier.SEVERE, tierCounts, weights, null);
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private ConflictResolution build(BlendStrategy strategy, Judgment judgment, double level, double confidence,
                                     List<ConflictRecord> conflicts, ConflictTier highest,
                                     Map<ConflictTier, Integer> tierCounts, Map<String, Double> weights,
                                     ArbitrationOutcome arbitration) {
        double clampedLevel = clamp(level);
        double clampedConfidence = clamp(confidence);
        List<String> recommendations = recommendations(strategy, clampedConfidence, tierCounts, arbitration);
        return new ConflictResolution(strategy, judgment, clampedLevel, clampedConfidence, conflicts, highest,
                tierCounts, weights, arbitration, recommendations);
    }

    private Map<String, Double> boostedWeights(List<TheoryResult> results) {
        return normalize(results, r -> Math.pow(r.confidence(), settings.confidenceBoost()));
    }

    private static Map<String, Double> normalize(List<TheoryResult> results, ToDoubleFunction<TheoryResult> raw) {
        double total = results.stream().mapToDouble(raw).sum();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (TheoryResult result : results) {
            // All-zero weights fall back to equal shares
            weights.put(result.theoryName(), total > 0.0 ? raw.applyAsDouble(result) / total : 1.0 / results.size());
        }
        return weights;
    }

    private static double weightedLevel(List<TheoryResult> results, Map<String, Double> weights) {
        return results.stream().mapToDouble(r -> r.level() * weights.get(r.theoryName())).sum();
    }

    private static double weightedConfidence(List<TheoryResult> results, Map<String, Double> weights) {
        return results.stream().mapToDouble(r -> r.confidence() * weights.get(r.theoryName())).sum();
    }

    private static TheoryResult find(List<TheoryResult> results, String name) {
        return results.stream()
                .filter(r -> r.theoryName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No result for " + name));
    }

    private static List<String> recommendations(BlendStrategy strategy, double confidence,
                                                Map<ConflictTier, Integer> tierCounts, ArbitrationOutcome arbitration) {
        List<String> advice = new ArrayList<>();
        switch (strategy) {
            case CONSENSUS_MODE -> advice.add("The theories agree; the verdict is well supported.");
            case SIMPLE_AVERAGE -> advice.add("The theories differ slightly; the verdict averages their readings.");
            case CONFIDENCE_WEIGHTED -> advice.add(
                    "The theories diverge noticeably; the more confident readings carry more weight.");
            case ARBITRATED -> {
                if (arbitration.isInconclusive()) {
                    advice.add("A tiebreaking theory could not settle the disagreement; treat the verdict as tentative.");
                } else {
                    advice.add("A tiebreaking theory (" + arbitration.arbitratorName()
                            + ") settled a sharp disagreement; consider its reading in detail.");
                }
            }
            case CONSERVATIVE_FALLBACK -> advice.add(
                    "The theories disagree sharply and no tiebreaker was available; the verdict is deliberately cautious.");
            default -> { }
        }
        if (tierCounts.getOrDefault(ConflictTier.SEVERE, 0) > 1) {
            advice.add("Several pairs of theories contradict each other; re-check the birth time and other details.");
        }
        if (confidence < 0.5) {
            advice.add("Overall confidence is low; more complete information would sharpen the reading.");
        }
        return advice;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
