package com.eainde.augury.theory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JudgmentTest {

    @Test
    @DisplayName("should map levels onto bands")
    void bands() {
        assertThat(Judgment.fromLevel(0.9)).isEqualTo(Judgment.VERY_FAVORABLE);
        assertThat(Judgment.fromLevel(0.65)).isEqualTo(Judgment.FAVORABLE);
        assertThat(Judgment.fromLevel(0.5)).isEqualTo(Judgment.NEUTRAL);
        assertThat(Judgment.fromLevel(0.2)).isEqualTo(Judgment.UNFAVORABLE);
        assertThat(Judgment.fromLevel(0.1)).isEqualTo(Judgment.VERY_UNFAVORABLE);
    }

    @Test
    @DisplayName("should map every canonical level back onto its own judgment")
    void canonicalRoundTrip() {
        for (Judgment judgment : Judgment.values()) {
            assertThat(Judgment.fromLevel(judgment.canonicalLevel())).isEqualTo(judgment);
        }
    }

    @Test
    @DisplayName("should oppose only across neutral")
    void opposes() {
        assertThat(Judgment.FAVORABLE.opposes(Judgment.VERY_UNFAVORABLE)).isTrue();
        assertThat(Judgment.UNFAVORABLE.opposes(Judgment.VERY_FAVORABLE)).isTrue();
        assertThat(Judgment.FAVORABLE.opposes(Judgment.NEUTRAL)).isFalse();
        assertThat(Judgment.FAVORABLE.opposes(Judgment.VERY_FAVORABLE)).isFalse();
    }
}
