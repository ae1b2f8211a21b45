package com.eainde.augury.conflict;

import com.eainde.augury.arbitration.ArbitrationOutcome;
import com.eainde.augury.arbitration.ArbitrationSettings;
import com.eainde.augury.arbitration.ArbitrationStatus;
import com.eainde.augury.arbitration.ArbitrationSystem;
import com.eainde.augury.error.ArbitrationUnavailableException;
import com.eainde.augury.error.InsufficientTheoriesException;
import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.TheoryResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConflictResolverTest {

    private final ConflictResolver resolver = new ConflictResolver(ConflictSettings.defaults());

    private static TheoryResult result(String name, double level, double confidence) {
        return TheoryResult.of(name, level, confidence, name + " reading");
    }

    private static TheoryResult result(String name, Judgment judgment, double level, double confidence) {
        return new TheoryResult(name, judgment, level, confidence, Map.of(), "", List.of());
    }

    // =========================================================================
    //  Classification
    // =========================================================================

    @Nested
    @DisplayName("Pair classification")
    class Classification {

        @Test
        @DisplayName("should map gaps onto tiers by the configured thresholds")
        void tiersByGap() {
            TheoryResult base = result("a", 0.70, 0.8);

            assertThat(resolver.classify(base, result("b", 0.75, 0.8))).isEqualTo(ConflictTier.CONSISTENT);
            assertThat(resolver.classify(base, result("b", 0.95, 0.8))).isEqualTo(ConflictTier.MINOR);
            assertThat(resolver.classify(base, result("b", 0.25, 0.8))).isEqualTo(ConflictTier.SEVERE);
        }

        @Test
        @DisplayName("should classify opposite judgments as severe regardless of the gap")
        void oppositeSidesAreSevere() {
            TheoryResult favorable = result("a", Judgment.FAVORABLE, 0.50, 0.8);
            TheoryResult unfavorable = result("b", Judgment.UNFAVORABLE, 0.45, 0.8);

            assertThat(resolver.classify(favorable, unfavorable)).isEqualTo(ConflictTier.SEVERE);
        }

        @Test
        @DisplayName("should classify a same-side pair beyond the significant threshold as severe")
        void sameSideWideGapIsSevere() {
            ConflictResolver narrow = new ConflictResolver(ConflictSettings.defaults().withThresholds(0.05, 0.10, 0.15));

            TheoryResult a = result("a", Judgment.VERY_FAVORABLE, 0.95, 0.8);
            TheoryResult b = result("b", Judgment.FAVORABLE, 0.66, 0.8);

            assertThat(narrow.classify(a, b)).isEqualTo(ConflictTier.SEVERE);
        }

        @Test
        @DisplayName("should be symmetric")
        void symmetric() {
            List<TheoryResult> samples = List.of(
                    result("a", 0.10, 0.5), result("b", 0.45, 0.9), result("c", 0.62, 0.3),
                    result("d", 0.90, 0.7), result("e", 0.51, 0.6));

            for (TheoryResult x : samples) {
                for (TheoryResult y : samples) {
                    assertThat(resolver.classify(x, y)).isEqualTo(resolver.classify(y, x));
                }
            }
        }
    }

    // =========================================================================
    //  Blending by tier
    // =========================================================================

    @Nested
    @DisplayName("Blending")
    class Blending {

        @Test
        @DisplayName("should use the confidence-weighted mode when every pair is consistent")
        void consensusMode() {
            ConflictResolution resolution = resolver.resolve(List.of(
                    result("a", 0.70, 0.9), result("b", 0.72, 0.6), result("c", 0.60, 0.4)));

            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.CONSENSUS_MODE);
            assertThat(resolution.highestTier()).isEqualTo(ConflictTier.CONSISTENT);
            assertThat(resolution.judgment()).isEqualTo(Judgment.FAVORABLE);
            assertThat(resolution.confidence()).isCloseTo((0.9 + 0.6 + 0.4) / 3, within(1e-9));
        }

        @Test
        @DisplayName("should average levels arithmetically for a minor gap")
        void minorUsesArithmeticMean() {
            ConflictResolver tight = new ConflictResolver(ConflictSettings.defaults().withThresholds(0.05, 0.15, 0.5));

            ConflictResolution resolution = tight.resolve(List.of(
                    result("a", Judgment.FAVORABLE, 0.70, 0.9),
                    result("b", Judgment.FAVORABLE, 0.80, 0.3)));

            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.SIMPLE_AVERAGE);
            assertThat(resolution.highestTier()).isEqualTo(ConflictTier.MINOR);
            assertThat(resolution.level()).isCloseTo(0.75, within(1e-9));
            assertThat(resolution.weights()).containsEntry("a", 0.5).containsEntry("b", 0.5);
        }

        @Test
        @DisplayName("should weight levels by boosted confidence for a significant gap")
        void significantUsesBoostedWeights() {
            ConflictResolver tight = new ConflictResolver(ConflictSettings.defaults().withThresholds(0.05, 0.15, 0.5));

            ConflictResolution resolution = tight.resolve(List.of(
                    result("a", Judgment.FAVORABLE, 0.80, 0.9),
                    result("b", Judgment.NEUTRAL, 0.60, 0.5)));

            double wa = Math.pow(0.9, 1.5);
            double wb = Math.pow(0.5, 1.5);
            double expected = (0.8 * wa + 0.6 * wb) / (wa + wb);

            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.CONFIDENCE_WEIGHTED);
            assertThat(resolution.level()).isCloseTo(expected, within(1e-9));
            assertThat(resolution.level()).isCloseTo(0.7414, within(1e-4));
            assertThat(resolution.level()).isGreaterThan((0.8 + 0.6) / 2);
        }

        @Test
        @DisplayName("should pick the blend from the highest tier across all pairs")
        void highestTierWins() {
            ConflictResolution resolution = resolver.resolve(List.of(
                    result("a", 0.70, 0.8), result("b", 0.72, 0.8), result("c", 0.95, 0.8)));

            assertThat(resolution.tierCounts()).containsEntry(ConflictTier.CONSISTENT, 1)
                    .containsEntry(ConflictTier.MINOR, 2);
            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.SIMPLE_AVERAGE);
            assertThat(resolution.conflicts()).hasSize(3);
        }

        @Test
        @DisplayName("should pass a single result through unchanged")
        void singleResult() {
            ConflictResolution resolution = resolver.resolve(List.of(result("only", 0.2, 0.6)));

            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.SINGLE_RESULT);
            assertThat(resolution.level()).isEqualTo(0.2);
            assertThat(resolution.confidence()).isEqualTo(0.6);
            assertThat(resolution.conflicts()).isEmpty();
        }

        @Test
        @DisplayName("should keep level and confidence within [0,1]")
        void clamped() {
            ConflictResolution resolution = resolver.resolve(List.of(
                    result("a", 1.0, 1.0), result("b", 0.0, 1.0), result("c", 1.0, 0.0)));

            assertThat(resolution.level()).isBetween(0.0, 1.0);
            assertThat(resolution.confidence()).isBetween(0.0, 1.0);
        }
    }

    // =========================================================================
    //  Severe conflicts
    // =========================================================================

    @Nested
    @DisplayName("Severe conflicts")
    class Severe {

        private final TheoryResult favorable = result("liuyao", Judgment.FAVORABLE, 0.75, 0.7);
        private final TheoryResult unfavorable = result("bazi", Judgment.UNFAVORABLE, 0.25, 0.6);

        @Test
        @DisplayName("should adopt the side the arbitrator agrees with")
        void arbitratedTowardFavorable() {
            ArbitrationSystem system = new ArbitrationSystem(ArbitrationSettings.defaults());
            TheoryResult arbiter = result("meihua", Judgment.FAVORABLE, 0.7, 0.65);
            Arbitrator arbitrator = (conflict, a, b) -> system.arbitrate(arbiter, a, b);

            ConflictResolution resolution = resolver.resolve(List.of(favorable, unfavorable), arbitrator);

            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.ARBITRATED);
            assertThat(resolution.judgment()).isEqualTo(Judgment.FAVORABLE);
            assertThat(resolution.confidence()).isGreaterThanOrEqualTo(favorable.confidence());
            assertThat(resolution.arbitrationStatus()).isEqualTo(ArbitrationStatus.COMPLETED);
            assertThat(resolution.conflicts().get(0).findArbitration()).isPresent();
        }

        @Test
        @DisplayName("should fall back conservatively when no arbitrator is available")
        void fallbackWhenUnavailable() {
            Arbitrator unavailable = (conflict, a, b) -> {
                throw new ArbitrationUnavailableException("career", "no candidate left");
            };

            ConflictResolution resolution = resolver.resolve(List.of(favorable, unfavorable), unavailable);

            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.CONSERVATIVE_FALLBACK);
            assertThat(resolution.confidence()).isLessThanOrEqualTo(0.5);
            assertThat(Math.abs(resolution.level() - 0.5)).isLessThan(Math.abs(0.25 - 0.5));
            assertThat(resolution.arbitrationStatus()).isEqualTo(ArbitrationStatus.UNAVAILABLE);
        }

        @Test
        @DisplayName("should fall back conservatively without an arbitrator")
        void fallbackWithoutArbitrator() {
            ConflictResolution resolution = resolver.resolve(List.of(favorable, unfavorable));

            assertThat(resolution.strategy()).isEqualTo(BlendStrategy.CONSERVATIVE_FALLBACK);
            assertThat(resolution.arbitration()).isNull();
        }

        @Test
        @DisplayName("should arbitrate the widest severe pair")
        void widestPair() {
            TheoryResult veryFavorable = result("qimen", Judgment.VERY_FAVORABLE, 0.95, 0.8);
            ArbitrationOutcome[] seen = new ArbitrationOutcome[1];
            Arbitrator arbitrator = (conflict, a, b) -> {
                assertThat(conflict.involves("qimen")).isTrue();
                assertThat(conflict.involves("bazi")).isTrue();
                seen[0] = new ArbitrationSystem(ArbitrationSettings.defaults())
                        .arbitrate(result("meihua", Judgment.NEUTRAL, 0.5, 0.5), a, b);
                return seen[0];
            };

            ConflictResolution resolution = resolver.resolve(List.of(favorable, unfavorable, veryFavorable), arbitrator);

            assertThat(resolution.arbitration()).isSameAs(seen[0]);
            assertThat(resolution.arbitrationStatus()).isEqualTo(ArbitrationStatus.INCONCLUSIVE);
        }
    }

    // =========================================================================
    //  Input errors
    // =========================================================================

    @Nested
    @DisplayName("Input errors")
    class InputErrors {

        @Test
        @DisplayName("should reject an empty result set")
        void empty() {
            assertThatThrownBy(() -> resolver.resolve(List.of()))
                    .isInstanceOf(InsufficientTheoriesException.class);
        }

        @Test
        @DisplayName("should reject two results of the same theory")
        void duplicate() {
            assertThatThrownBy(() -> resolver.resolve(List.of(result("a", 0.5, 0.5), result("a", 0.6, 0.5))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("a");
        }
    }
}
