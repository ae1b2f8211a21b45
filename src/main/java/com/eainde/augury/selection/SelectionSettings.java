package com.eainde.augury.selection;

/**
 * Tunables of {@link TheorySelector}.
 *
 * @param maxTheories        upper bound on the number of theories selected
 * @param minTheories        number of theories a selection should reach before it stops lowering the bar
 * @param primaryThreshold   fitness a theory must exceed in the first pass
 * @param fallbackThreshold  lower fitness bar used when the first pass selects fewer than {@code minTheories}
 * @param completenessWeight fitness weight of information completeness
 * @param affinityWeight     fitness weight of category affinity
 * @param personalityWeight  fitness weight of the personality axis
 * @param ensureTierCoverage pick the best theory of each execution tier before filling by fitness
 */
public record SelectionSettings(
        int maxTheories,
        int minTheories,
        double primaryThreshold,
        double fallbackThreshold,
        double completenessWeight,
        double affinityWeight,
        double personalityWeight,
        boolean ensureTierCoverage
) {

    public SelectionSettings {
        if (maxTheories < 1) {
            throw new IllegalArgumentException("maxTheories must be at least 1");
        }
        if (minTheories < 1 || minTheories > maxTheories) {
            throw new IllegalArgumentException("minTheories must be within [1, maxTheories]");
        }
        if (fallbackThreshold > primaryThreshold) {
            throw new IllegalArgumentException("fallbackThreshold must not exceed primaryThreshold");
        }
    }

    public static SelectionSettings defaults() {
        return new SelectionSettings(5, 3, 0.30, 0.15, 0.40, 0.35, 0.25, false);
    }
}
