package com.eainde.augury.theory.runner;

import com.eainde.augury.error.CalculationException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.TheoryCatalog;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryNames;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeihuaRunnerTest {

    private final MeihuaRunner runner = new MeihuaRunner();
    private final TheoryDescriptor descriptor = TheoryCatalog.descriptors().stream()
            .filter(d -> d.getName().equals(TheoryNames.MEIHUA)).findFirst().orElseThrow();

    @Test
    @DisplayName("should read harmony when body and use share an element")
    void harmony() {
        TheoryResult result = runner.run(descriptor,
                UserInput.of(Map.of(FieldNames.NUMBERS, List.of(1, 2, 3))));

        assertThat(result.payload()).containsEntry("relation", "HARMONY");
        assertThat(result.judgment()).isEqualTo(Judgment.NEUTRAL);
    }

    @Test
    @DisplayName("should read support when the use element generates the body")
    void nourished() {
        TheoryResult result = runner.run(descriptor,
                UserInput.of(Map.of(FieldNames.NUMBERS, List.of(1, 6, 4))));

        assertThat(result.payload()).containsEntry("body", "KAN").containsEntry("use", "QIAN");
        assertThat(result.judgment()).isEqualTo(Judgment.VERY_FAVORABLE);
    }

    @Test
    @DisplayName("should cast from a color and the inquiry time")
    void colorCast() {
        TheoryResult result = runner.run(descriptor, UserInput.of(Map.of(
                FieldNames.FAVORITE_COLOR, "Red", FieldNames.INQUIRY_TIME, "2024-03-05T10:15:00")));

        assertThat(result.payload()).containsEntry("upper", "LI");
    }

    @Test
    @DisplayName("should fail for a color without the inquiry time")
    void colorWithoutTime() {
        assertThatThrownBy(() -> runner.run(descriptor, UserInput.of(Map.of(FieldNames.FAVORITE_COLOR, "red"))))
                .isInstanceOf(CalculationException.class);
    }

    @Test
    @DisplayName("should classify the five element relations")
    void relations() {
        assertThat(MeihuaRunner.relation(MeihuaRunner.Element.WOOD, MeihuaRunner.Element.WATER))
                .isEqualTo(MeihuaRunner.Relation.USE_NOURISHES_BODY);
        assertThat(MeihuaRunner.relation(MeihuaRunner.Element.WOOD, MeihuaRunner.Element.FIRE))
                .isEqualTo(MeihuaRunner.Relation.BODY_NOURISHES_USE);
        assertThat(MeihuaRunner.relation(MeihuaRunner.Element.WOOD, MeihuaRunner.Element.EARTH))
                .isEqualTo(MeihuaRunner.Relation.BODY_CONTROLS_USE);
        assertThat(MeihuaRunner.relation(MeihuaRunner.Element.WOOD, MeihuaRunner.Element.METAL))
                .isEqualTo(MeihuaRunner.Relation.USE_CONTROLS_BODY);
    }
}
