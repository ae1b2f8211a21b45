package com.eainde.augury.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * One retrospective question tied to a claim of one theory.
 *
 * @param index           position in the round, starting at 1
 * @param theoryName      theory whose claim is checked
 * @param claim           the past fact being checked
 * @param question        text shown to the user
 * @param shape           expected answer shape
 * @param expectedAnswers answers that confirm the claim
 * @param choices         options for {@link AnswerShape#CHOICE}
 */
public record VerificationQuestion(
        @JsonProperty("index")            int index,
        @JsonProperty("theory")           String theoryName,
        @JsonProperty("claim")            String claim,
        @JsonProperty("question")         String question,
        @JsonProperty("shape")            AnswerShape shape,
        @JsonProperty("expected_answers") List<String> expectedAnswers,
        @JsonProperty("choices")          List<String> choices
) implements Serializable {

    public VerificationQuestion {
        expectedAnswers = List.copyOf(expectedAnswers);
        choices = List.copyOf(choices);
    }

    public static VerificationQuestion of(int index, String theoryName, RetrospectiveClaim claim) {
        return new VerificationQuestion(index, theoryName, claim.claim(), claim.question(), claim.shape(),
                claim.expectedAnswers(), claim.choices());
    }

    /** Question text with its options, as shown to the user. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(index).append(". ").append(question);
        switch (shape) {
            case YES_NO -> sb.append(" (yes / no)");
            case YEAR -> sb.append(" (a year, e.g. 2019)");
            case CHOICE -> sb.append(" (").append(String.join(" / ", choices)).append(')');
            default -> { }
        }
        return sb.toString();
    }
}
