package com.eainde.augury.theory;

import com.eainde.augury.verification.RetrospectiveClaim;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one theory run. Immutable; a confidence revision produces a new instance.
 *
 * @param theoryName     the theory that produced it
 * @param judgment       verdict on the shared ordered scale
 * @param level          normalized strength of the verdict, within [0,1]
 * @param confidence     the theory's reliability for this result, within [0,1]
 * @param payload        opaque calculation details
 * @param interpretation free-text reading
 * @param claims         checkable statements about the past, used for verification
 */
public record TheoryResult(
        @JsonProperty("theory")         String theoryName,
        @JsonProperty("judgment")       Judgment judgment,
        @JsonProperty("level")          double level,
        @JsonProperty("confidence")     double confidence,
        @JsonProperty("payload")        Map<String, Object> payload,
        @JsonProperty("interpretation") String interpretation,
        @JsonProperty("claims")         List<RetrospectiveClaim> claims
) implements Serializable {

    public TheoryResult {
        if (theoryName == null || theoryName.isBlank()) {
            throw new IllegalArgumentException("theoryName is required");
        }
        if (judgment == null) {
            throw new IllegalArgumentException("judgment is required for theory: " + theoryName);
        }
        if (Double.isNaN(level) || level < 0.0 || level > 1.0) {
            throw new IllegalArgumentException("level must be within [0,1] for theory: " + theoryName + ", was " + level);
        }
        // A judgment may round toward neutral but never cross it
        if (judgment.opposes(Judgment.fromLevel(level))) {
            throw new IllegalArgumentException("judgment " + judgment + " contradicts level " + level
                    + " for theory: " + theoryName);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence must be within [0,1] for theory: " + theoryName + ", was " + confidence);
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        interpretation = interpretation == null ? "" : interpretation;
        claims = claims == null ? List.of() : List.copyOf(claims);
    }

    /**
     * Result whose judgment is derived from the level.
     */
    public static TheoryResult of(String theoryName, double level, double confidence, String interpretation) {
        return new TheoryResult(theoryName, Judgment.fromLevel(level), level, confidence, Map.of(), interpretation, List.of());
    }

    public TheoryResult withConfidence(double newConfidence) {
        double clamped = Math.max(0.0, Math.min(1.0, newConfidence));
        return new TheoryResult(theoryName, judgment, level, clamped, payload, interpretation, claims);
    }

    public TheoryResult withClaims(List<RetrospectiveClaim> newClaims) {
        return new TheoryResult(theoryName, judgment, level, confidence, payload, interpretation, newClaims);
    }
}
