package com.eainde.augury.conflict;

/**
 * Thresholds and blend parameters of {@link ConflictResolver}.
 *
 * @param consistentThreshold   ε1: gaps up to this are consistent
 * @param minorThreshold        ε2: gaps up to this are minor
 * @param significantThreshold  ε3: gaps up to this are significant, beyond is severe
 * @param confidenceBoost       exponent c applied to confidences in the weighted blend; must exceed 1
 * @param fallbackDampening     share of the blended deviation from neutral kept by the conservative fallback
 * @param fallbackConfidenceCap confidence ceiling of the conservative fallback
 */
public record ConflictSettings(
        double consistentThreshold,
        double minorThreshold,
        double significantThreshold,
        double confidenceBoost,
        double fallbackDampening,
        double fallbackConfidenceCap
) {

    public ConflictSettings {
        if (consistentThreshold < 0.0 || consistentThreshold > minorThreshold || minorThreshold > significantThreshold
                || significantThreshold > 1.0) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 <= e1 <= e2 <= e3 <= 1");
        }
        if (confidenceBoost <= 1.0) {
            throw new IllegalArgumentException("confidenceBoost must be greater than 1");
        }
        if (fallbackDampening < 0.0 || fallbackDampening > 1.0) {
            throw new IllegalArgumentException("fallbackDampening must be within [0,1]");
        }
        if (fallbackConfidenceCap < 0.0 || fallbackConfidenceCap > 1.0) {
            throw new IllegalArgumentException("fallbackConfidenceCap must be within [0,1]");
        }
    }

    public static ConflictSettings defaults() {
        return new ConflictSettings(0.2, 0.4, 0.5, 1.5, 0.5, 0.5);
    }

    public ConflictSettings withThresholds(double e1, double e2, double e3) {
        return new ConflictSettings(e1, e2, e3, confidenceBoost, fallbackDampening, fallbackConfidenceCap);
    }
}
