package com.eainde.augury.theory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TheoryDescriptorTest {

    private static TheoryDescriptor catalog(String name) {
        return TheoryCatalog.descriptors().stream()
                .filter(d -> d.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    // =========================================================================
    //  Completeness and eligibility
    // =========================================================================

    @Nested
    @DisplayName("Completeness")
    class Completeness {

        @Test
        @DisplayName("should sum the weights of present fields")
        void weightedSum() {
            TheoryDescriptor bazi = catalog(TheoryNames.BAZI);
            UserInput input = UserInput.of(Map.of(
                    FieldNames.BIRTH_YEAR, 1990, FieldNames.BIRTH_MONTH, 5, FieldNames.BIRTH_DAY, 12));

            assertThat(bazi.completeness(input)).isCloseTo(0.75 / 0.95, within(1e-9));
            assertThat(bazi.isEligible(input)).isTrue();
        }

        @Test
        @DisplayName("should not count skipped fields")
        void skippedIsAbsent() {
            TheoryDescriptor ziwei = catalog(TheoryNames.ZIWEI);
            UserInput input = UserInput.of(Map.of(
                            FieldNames.QUESTION_CATEGORY, "career", FieldNames.QUESTION_DESCRIPTION, "new job offer",
                            FieldNames.BIRTH_YEAR, 1990, FieldNames.BIRTH_MONTH, 5, FieldNames.BIRTH_DAY, 12,
                            FieldNames.GENDER, "female"))
                    .withSkipped(FieldNames.BIRTH_HOUR);

            assertThat(ziwei.completeness(input)).isCloseTo(0.8, within(1e-9));
            assertThat(ziwei.missingRequired(input)).containsExactly(FieldNames.BIRTH_HOUR);
            assertThat(ziwei.isEligible(input)).isFalse();
        }

        @Test
        @DisplayName("should stay within [0,1]")
        void bounded() {
            for (TheoryDescriptor descriptor : TheoryCatalog.descriptors()) {
                assertThat(descriptor.completeness(UserInput.empty())).isBetween(0.0, 1.0);
            }
        }

        @Test
        @DisplayName("should make a theory without required fields eligible on empty input when min is zero")
        void optionalOnly() {
            assertThat(catalog(TheoryNames.XIAOLIU).isEligible(UserInput.empty())).isTrue();
            assertThat(catalog(TheoryNames.XIAOLIU).completeness(UserInput.empty())).isZero();
        }
    }

    @Test
    @DisplayName("should report the fields a theory reads")
    void dependsOn() {
        TheoryDescriptor liuyao = catalog(TheoryNames.LIUYAO);

        assertThat(liuyao.dependsOn(FieldNames.NUMBERS)).isTrue();
        assertThat(liuyao.dependsOn(FieldNames.QUESTION_DESCRIPTION)).isTrue();
        assertThat(liuyao.dependsOn(FieldNames.FAVORITE_COLOR)).isFalse();
    }

    @Test
    @DisplayName("should reject weights outside [0,1]")
    void invalidWeight() {
        assertThatThrownBy(() -> TheoryDescriptor.of("x", "X", TheoryTier.FAST).required("a", 1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should ship eight theories in declaration order")
    void catalogOrder() {
        assertThat(TheoryCatalog.descriptors()).extracting(TheoryDescriptor::getName).isEqualTo(List.of(
                TheoryNames.XIAOLIU, TheoryNames.CEZI, TheoryNames.MEIHUA, TheoryNames.BAZI, TheoryNames.ZIWEI,
                TheoryNames.QIMEN, TheoryNames.DALIUREN, TheoryNames.LIUYAO));
    }
}
