package com.eainde.augury.conversation;

import com.eainde.augury.theory.FieldNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValidatorsTest {

    // =========================================================================
    //  Seeds
    // =========================================================================

    @Nested
    @DisplayName("Seeds")
    class Seeds {

        private final FieldValidator numbers = FieldValidators.numbers();

        @Test
        @DisplayName("should read three numbers from a sentence")
        void threeNumbers() {
            assertThat(numbers.detect(FieldNames.NUMBERS, "career, 3 7 2").value()).isEqualTo(List.of(3, 7, 2));
            assertThat(numbers.detect(FieldNames.NUMBERS, "358").value()).isEqualTo(List.of(3, 5, 8));
        }

        @Test
        @DisplayName("should flag a wrong count as ambiguous and out-of-range digits as invalid")
        void rejects() {
            assertThat(numbers.detect(FieldNames.NUMBERS, "3 and 5").status()).isEqualTo(FieldCheck.Status.AMBIGUOUS);
            assertThat(numbers.detect(FieldNames.NUMBERS, "3 5 12").status()).isEqualTo(FieldCheck.Status.INVALID);
            assertThat(numbers.validate(FieldNames.NUMBERS, List.of(1, 2, 3)).value()).isEqualTo(List.of(1, 2, 3));
        }

        @Test
        @DisplayName("should read one character and refuse several")
        void character() {
            FieldValidator character = FieldValidators.character();

            assertThat(character.detect(FieldNames.CHARACTER, "My character is 福").value()).isEqualTo("福");
            assertThat(character.detect(FieldNames.CHARACTER, "福禄").status()).isEqualTo(FieldCheck.Status.AMBIGUOUS);
            assertThat(character.validate(FieldNames.CHARACTER, "ab").status()).isEqualTo(FieldCheck.Status.INVALID);
        }
    }

    // =========================================================================
    //  Category
    // =========================================================================

    @Nested
    @DisplayName("Category")
    class Category {

        private final FieldValidator category = FieldValidators.questionCategory();

        @Test
        @DisplayName("should detect a single category and ask on a tie")
        void detect() {
            assertThat(category.detect(FieldNames.QUESTION_CATEGORY, "it's about my career").value()).isEqualTo("career");
            assertThat(category.detect(FieldNames.QUESTION_CATEGORY, "my job and my money").status())
                    .isEqualTo(FieldCheck.Status.AMBIGUOUS);
        }

        @Test
        @DisplayName("should validate keys and reject unknown ones")
        void validate() {
            assertThat(category.validate(FieldNames.QUESTION_CATEGORY, "Love").value()).isEqualTo("love");
            assertThat(category.validate(FieldNames.QUESTION_CATEGORY, "astrology").status())
                    .isEqualTo(FieldCheck.Status.INVALID);
        }
    }

    // =========================================================================
    //  Birth data
    // =========================================================================

    @Nested
    @DisplayName("Birth data")
    class BirthData {

        private static final String NAMED_DATE = "I was born on May 12th, 1990";

        @Test
        @DisplayName("should split a named date into year, month and day")
        void namedDate() {
            assertThat(FieldValidators.birthYear().detect(FieldNames.BIRTH_YEAR, NAMED_DATE).value()).isEqualTo(1990);
            assertThat(FieldValidators.birthMonth().detect(FieldNames.BIRTH_MONTH, NAMED_DATE).value()).isEqualTo(5);
            assertThat(FieldValidators.birthDay().detect(FieldNames.BIRTH_DAY, NAMED_DATE).value()).isEqualTo(12);
        }

        @Test
        @DisplayName("should not read the verb 'may' as a month")
        void mayAsVerb() {
            assertThat(FieldValidators.birthMonth().detect(FieldNames.BIRTH_MONTH, "I may have been born in spring").status())
                    .isEqualTo(FieldCheck.Status.ABSENT);
        }

        @Test
        @DisplayName("should normalise clock times to a 24-hour value")
        void hours() {
            FieldValidator hour = FieldValidators.birthHour();

            assertThat(hour.detect(FieldNames.BIRTH_HOUR, "around 2:30 pm").value()).isEqualTo(14);
            assertThat(hour.detect(FieldNames.BIRTH_HOUR, "at 12am").value()).isEqualTo(0);
            assertThat(hour.validate(FieldNames.BIRTH_HOUR, 25).status()).isEqualTo(FieldCheck.Status.INVALID);
        }

        @Test
        @DisplayName("should reject years before 1900")
        void earlyYear() {
            FieldCheck check = FieldValidators.birthYear().detect(FieldNames.BIRTH_YEAR, "born 1850");

            assertThat(check.status()).isEqualTo(FieldCheck.Status.INVALID);
            assertThat(check.hint()).contains("1900");
        }

        @Test
        @DisplayName("should read gender, MBTI and certainty")
        void profile() {
            assertThat(FieldValidators.gender().detect(FieldNames.GENDER, "I'm a woman").value()).isEqualTo("female");
            assertThat(FieldValidators.personalityType().detect(FieldNames.PERSONALITY_TYPE, "I'm an infj").value())
                    .isEqualTo("INFJ");
            assertThat(FieldValidators.birthTimeCertainty().detect(FieldNames.BIRTH_TIME_CERTAINTY, "around 3:00").value())
                    .isEqualTo("uncertain");
        }
    }
}
