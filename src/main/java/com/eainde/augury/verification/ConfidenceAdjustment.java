package com.eainde.augury.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * @param theoryName theory whose confidence changed
 * @param delta      nominal delta of the verdict; the applied change may be smaller after clamping
 * @param verdict    classification that produced the delta
 * @param before     confidence before this adjustment
 * @param after      confidence after this adjustment, within [0,1]
 * @param appliedAt  when the adjustment was applied
 */
public record ConfidenceAdjustment(
        @JsonProperty("theory")     String theoryName,
        @JsonProperty("delta")      double delta,
        @JsonProperty("verdict")    FeedbackVerdict verdict,
        @JsonProperty("before")     double before,
        @JsonProperty("after")      double after,
        @JsonProperty("applied_at") Instant appliedAt
) implements Serializable {
}
