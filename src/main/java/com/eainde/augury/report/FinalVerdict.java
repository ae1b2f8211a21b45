package com.eainde.augury.report;

import com.eainde.augury.conflict.BlendStrategy;
import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.theory.Judgment;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * The one answer the report leads with.
 */
public record FinalVerdict(
        @JsonProperty("judgment")   Judgment judgment,
        @JsonProperty("level")      double level,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("strategy")   BlendStrategy strategy
) implements Serializable {

    public static FinalVerdict of(ConflictResolution resolution) {
        return new FinalVerdict(resolution.judgment(), resolution.level(), resolution.confidence(),
                resolution.strategy());
    }
}
