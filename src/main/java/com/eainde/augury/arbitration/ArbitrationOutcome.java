package com.eainde.augury.arbitration;

import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.TheoryResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Result of arbitrating one severe conflict.
 *
 * @param arbitratorName     theory consulted as tiebreaker
 * @param arbitratorResult   its result
 * @param verdict            which side it matched
 * @param matchedTheory      the matched side's theory; null for {@code BOTH} and {@code NEITHER}
 * @param adoptedJudgment    judgment the resolution adopts
 * @param adoptedLevel       level the resolution adopts
 * @param originalConfidence confidence before arbitration (matched side, or mean of the pair)
 * @param adjustedConfidence confidence after arbitration
 */
public record ArbitrationOutcome(
        @JsonProperty("arbitrator")          String arbitratorName,
        @JsonProperty("arbitrator_result")   TheoryResult arbitratorResult,
        @JsonProperty("verdict")             ArbitrationVerdict verdict,
        @JsonProperty("matched_theory")      String matchedTheory,
        @JsonProperty("adopted_judgment")    Judgment adoptedJudgment,
        @JsonProperty("adopted_level")       double adoptedLevel,
        @JsonProperty("original_confidence") double originalConfidence,
        @JsonProperty("adjusted_confidence") double adjustedConfidence
) implements Serializable {

    @JsonIgnore
    public boolean isInconclusive() {
        return verdict == ArbitrationVerdict.NEITHER;
    }

    @JsonProperty("confidence_adjustment")
    public double confidenceAdjustment() {
        return adjustedConfidence - originalConfidence;
    }
}
