package com.eainde.augury.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A verification question with the user's answer and how it was classified.
 */
public record VerificationRecord(
        @JsonProperty("question") VerificationQuestion question,
        @JsonProperty("answer")   String answer,
        @JsonProperty("verdict")  FeedbackVerdict verdict
) implements Serializable {
}
