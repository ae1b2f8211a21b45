package com.eainde.augury.theory.runner;

import com.eainde.augury.error.CalculationException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.TheoryCatalog;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryNames;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeededTheoryRunnerTest {

    private final SeededTheoryRunner runner = new SeededTheoryRunner(TheoryNames.BAZI);
    private final TheoryDescriptor bazi = TheoryCatalog.descriptors().stream()
            .filter(d -> d.getName().equals(TheoryNames.BAZI)).findFirst().orElseThrow();

    private static UserInput birth(int year) {
        return UserInput.of(Map.of(
                FieldNames.BIRTH_YEAR, year, FieldNames.BIRTH_MONTH, 5, FieldNames.BIRTH_DAY, 12,
                FieldNames.INQUIRY_TIME, "2024-03-05T10:15:00"));
    }

    @Test
    @DisplayName("should return identical results for identical input")
    void deterministic() {
        assertThat(runner.run(bazi, birth(1990))).isEqualTo(runner.run(bazi, birth(1990)));
    }

    @Test
    @DisplayName("should derive confidence from completeness and attach claims")
    void confidenceAndClaims() {
        TheoryResult result = runner.run(bazi, birth(1990));

        assertThat(result.level()).isBetween(0.05, 0.95);
        assertThat(result.confidence()).isBetween(0.5, 0.8);
        assertThat(result.claims()).isNotEmpty();
        assertThat(result.payload()).containsEntry("estimator", "seeded");
    }

    @Test
    @DisplayName("should refuse to run with required fields missing")
    void missingRequired() {
        assertThatThrownBy(() -> runner.run(bazi, UserInput.of(Map.of(FieldNames.BIRTH_YEAR, 1990))))
                .isInstanceOf(CalculationException.class)
                .hasMessageContaining(FieldNames.BIRTH_MONTH);
    }
}
