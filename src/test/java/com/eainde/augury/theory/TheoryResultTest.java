package com.eainde.augury.theory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TheoryResultTest {

    private static TheoryResult result(Judgment judgment, double level) {
        return new TheoryResult("meihua", judgment, level, 0.6, Map.of(), "", List.of());
    }

    @Test
    @DisplayName("should reject a judgment on the other side of neutral from its level")
    void contradictoryJudgment() {
        assertThatThrownBy(() -> result(Judgment.FAVORABLE, 0.10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("contradicts level");
        assertThatThrownBy(() -> result(Judgment.VERY_UNFAVORABLE, 0.90))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should accept a judgment that only leans further than its level")
    void leaningJudgment() {
        assertThat(result(Judgment.FAVORABLE, 0.50).judgment()).isEqualTo(Judgment.FAVORABLE);
        assertThat(result(Judgment.NEUTRAL, 0.95).judgment()).isEqualTo(Judgment.NEUTRAL);
        assertThat(result(Judgment.UNFAVORABLE, 0.40).level()).isEqualTo(0.40);
    }

    @Test
    @DisplayName("should reject out of range level and confidence")
    void ranges() {
        assertThatThrownBy(() -> result(Judgment.NEUTRAL, 1.2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TheoryResult("meihua", Judgment.NEUTRAL, 0.5, -0.1, Map.of(), "", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should clamp a revised confidence and keep the reading")
    void withConfidence() {
        TheoryResult revised = TheoryResult.of("meihua", 0.7, 0.6, "steady").withConfidence(1.4);

        assertThat(revised.confidence()).isEqualTo(1.0);
        assertThat(revised.judgment()).isEqualTo(Judgment.FAVORABLE);
        assertThat(revised.interpretation()).isEqualTo("steady");
    }
}
