package com.eainde.augury.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A checkable statement about the user's past that a theory derived from its calculation.
 *
 * @param claim           the statement, e.g. "a job change around 2019"
 * @param question        how to ask the user about it
 * @param shape           expected answer shape
 * @param expectedAnswers answers that confirm the claim (for YES_NO: "yes" or "no")
 * @param choices         the options offered for {@link AnswerShape#CHOICE}, empty otherwise
 */
public record RetrospectiveClaim(
        @JsonProperty("claim")            String claim,
        @JsonProperty("question")         String question,
        @JsonProperty("shape")            AnswerShape shape,
        @JsonProperty("expected_answers") List<String> expectedAnswers,
        @JsonProperty("choices")          List<String> choices
) implements Serializable {

    public RetrospectiveClaim {
        expectedAnswers = expectedAnswers == null ? List.of() : List.copyOf(expectedAnswers);
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static RetrospectiveClaim yesNo(String claim, String question, boolean expectYes) {
        return new RetrospectiveClaim(claim, question, AnswerShape.YES_NO, List.of(expectYes ? "yes" : "no"), List.of());
    }

    public static RetrospectiveClaim year(String claim, String question, int expectedYear) {
        return new RetrospectiveClaim(claim, question, AnswerShape.YEAR, List.of(String.valueOf(expectedYear)), List.of());
    }
}
