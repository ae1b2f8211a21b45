package com.eainde.augury.conflict;

/**
 * How a {@link ConflictResolution} blended its inputs.
 */
public enum BlendStrategy {
    SINGLE_RESULT,
    /** Tier 1: confidence-weighted mode of judgments. */
    CONSENSUS_MODE,
    /** Tier 2: arithmetic mean of levels. */
    SIMPLE_AVERAGE,
    /** Tier 3: mean weighted by confidence raised to the boost exponent. */
    CONFIDENCE_WEIGHTED,
    /** Tier 4 settled by an additional theory. */
    ARBITRATED,
    /** Tier 4 without arbitration: weighted blend pulled toward neutral. */
    CONSERVATIVE_FALLBACK
}
