package com.eainde.augury.verification;

import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerClassifierTest {

    private final AnswerClassifier classifier = new AnswerClassifier();

    private static VerificationQuestion yesNo(boolean expectYes) {
        return VerificationQuestion.of(1, "bazi",
                RetrospectiveClaim.yesNo("a job change", "Did you change jobs in the past three years?", expectYes));
    }

    private static VerificationQuestion fromTemplate(int template, Judgment judgment) {
        TheoryResult result = new TheoryResult("meihua", judgment, judgment.canonicalLevel(), 0.7, Map.of(), "", List.of());
        return VerificationQuestion.of(1, "meihua",
                QuestionTemplates.claimsFor(QuestionCategory.CAREER, result).get(template));
    }

    // =========================================================================
    //  Yes / no
    // =========================================================================

    @Nested
    @DisplayName("Yes / no answers")
    class YesNo {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource(delimiter = '|', value = {
                "Yes                         | CONFIRMED",
                "yeah, I did                 | CONFIRMED",
                "No                          | DENIED",
                "Nope, I haven't moved at all | DENIED",
                "sort of, yes                | PARTIALLY_CONFIRMED",
                "I'm not sure                | UNKNOWN",
                "the weather is nice         | UNKNOWN"
        })
        void expectingYes(String answer, FeedbackVerdict expected) {
            assertThat(classifier.classify(yesNo(true), answer)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should confirm a no when the claim expects no")
        void expectingNo() {
            assertThat(classifier.classify(yesNo(false), "no, never")).isEqualTo(FeedbackVerdict.CONFIRMED);
        }

        @Test
        @DisplayName("should let negation win over affirmative words")
        void negationWins() {
            assertThat(classifier.classify(yesNo(true), "yes but not really")).isEqualTo(FeedbackVerdict.DENIED);
        }

        @Test
        @DisplayName("should treat a blank answer as unknown")
        void blank() {
            assertThat(classifier.classify(yesNo(true), "  ")).isEqualTo(FeedbackVerdict.UNKNOWN);
            assertThat(classifier.classify(yesNo(true), null)).isEqualTo(FeedbackVerdict.UNKNOWN);
        }
    }

    // =========================================================================
    //  Years, choices and free text
    // =========================================================================

    @Nested
    @DisplayName("Other answer shapes")
    class OtherShapes {

        private final VerificationQuestion year = VerificationQuestion.of(2, "bazi",
                RetrospectiveClaim.year("a turning point in 2015", "Which year did things turn?", 2015));

        @Test
        @DisplayName("should grade years by distance")
        void years() {
            assertThat(classifier.classify(year, "It was 2015")).isEqualTo(FeedbackVerdict.CONFIRMED);
            assertThat(classifier.classify(year, "around 2016")).isEqualTo(FeedbackVerdict.PARTIALLY_CONFIRMED);
            assertThat(classifier.classify(year, "2010")).isEqualTo(FeedbackVerdict.DENIED);
            assertThat(classifier.classify(year, "no, nothing like that")).isEqualTo(FeedbackVerdict.DENIED);
        }

        @Test
        @DisplayName("should grade trend choices by distance and synonyms")
        void trend() {
            VerificationQuestion question = fromTemplate(2, Judgment.FAVORABLE);

            assertThat(classifier.classify(question, "Better")).isEqualTo(FeedbackVerdict.CONFIRMED);
            assertThat(classifier.classify(question, "about the same")).isEqualTo(FeedbackVerdict.PARTIALLY_CONFIRMED);
            assertThat(classifier.classify(question, "it has declined")).isEqualTo(FeedbackVerdict.DENIED);
        }

        @Test
        @DisplayName("should score free text by keyword overlap")
        void freeText() {
            TheoryResult result = new TheoryResult("meihua", Judgment.FAVORABLE, 0.7, 0.7, Map.of(), "", List.of());
            VerificationQuestion question = VerificationQuestion.of(3, "meihua",
                    QuestionTemplates.claimsFor(QuestionCategory.DECISION, result).get(2));

            assertThat(classifier.classify(question, "It worked and I'm glad")).isEqualTo(FeedbackVerdict.CONFIRMED);
            assertThat(classifier.classify(question, "it went well")).isEqualTo(FeedbackVerdict.PARTIALLY_CONFIRMED);
            assertThat(classifier.classify(question, "I regret it")).isEqualTo(FeedbackVerdict.DENIED);
        }
    }
}
