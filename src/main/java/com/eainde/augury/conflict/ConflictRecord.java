package com.eainde.augury.conflict;

import com.eainde.augury.arbitration.ArbitrationOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Optional;

/**
 * Disagreement between one pair of results.
 *
 * @param theoryA     first theory of the pair
 * @param theoryB     second theory of the pair
 * @param delta       absolute difference of their levels
 * @param tier        severity
 * @param arbitration outcome when this pair was arbitrated, otherwise null
 */
public record ConflictRecord(
        @JsonProperty("theory_a")    String theoryA,
        @JsonProperty("theory_b")    String theoryB,
        @JsonProperty("delta")       double delta,
        @JsonProperty("tier")        ConflictTier tier,
        @JsonProperty("arbitration") ArbitrationOutcome arbitration
) implements Serializable {

    public ConflictRecord withArbitration(ArbitrationOutcome outcome) {
        return new ConflictRecord(theoryA, theoryB, delta, tier, outcome);
    }

    public Optional<ArbitrationOutcome> findArbitration() {
        return Optional.ofNullable(arbitration);
    }

    public boolean involves(String theoryName) {
        return theoryA.equals(theoryName) || theoryB.equals(theoryName);
    }
}
