package com.eainde.augury.conflict;

import com.eainde.augury.arbitration.ArbitrationOutcome;
import com.eainde.augury.arbitration.ArbitrationStatus;
import com.eainde.augury.theory.Judgment;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One blended verdict over a complete set of results.
 *
 * @param strategy        blending rule chosen from the highest tier observed
 * @param judgment        blended judgment
 * @param level           blended level
 * @param confidence      blended confidence
 * @param conflicts       every pairwise comparison, in result order
 * @param highestTier     most severe tier among all pairs
 * @param tierCounts      number of pairs per tier
 * @param weights         normalized contribution of each theory to the blend
 * @param arbitration     arbitration outcome, null when none took place
 * @param recommendations advice for reading the verdict
 */
public record ConflictResolution(
        @JsonProperty("strategy")        BlendStrategy strategy,
        @JsonProperty("judgment")        Judgment judgment,
        @JsonProperty("level")           double level,
        @JsonProperty("confidence")      double confidence,
        @JsonProperty("conflicts")       List<ConflictRecord> conflicts,
        @JsonProperty("highest_tier")    ConflictTier highestTier,
        @JsonProperty("tier_counts")     Map<ConflictTier, Integer> tierCounts,
        @JsonProperty("weights")         Map<String, Double> weights,
        @JsonProperty("arbitration")     ArbitrationOutcome arbitration,
        @JsonProperty("recommendations") List<String> recommendations
) implements Serializable {

    public ConflictResolution {
        conflicts = List.copyOf(conflicts);
        EnumMap<ConflictTier, Integer> counts = new EnumMap<>(ConflictTier.class);
        counts.putAll(tierCounts);
        tierCounts = Collections.unmodifiableMap(counts);
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        recommendations = List.copyOf(recommendations);
    }

    @JsonProperty("arbitration_status")
    public ArbitrationStatus arbitrationStatus() {
        if (arbitration != null) {
            return arbitration.isInconclusive() ? ArbitrationStatus.INCONCLUSIVE : ArbitrationStatus.COMPLETED;
        }
        return highestTier == ConflictTier.SEVERE ? ArbitrationStatus.UNAVAILABLE : ArbitrationStatus.NOT_NEEDED;
    }

    /** Human-readable count of pairs per tier. */
    public String summary() {
        if (conflicts.isEmpty()) {
            return "Single result, no comparison.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(conflicts.size()).append(" pair(s) compared:");
        tierCounts.forEach((tier, count) -> sb.append(' ').append(tier.name().toLowerCase()).append('=').append(count));
        return sb.toString();
    }
}
