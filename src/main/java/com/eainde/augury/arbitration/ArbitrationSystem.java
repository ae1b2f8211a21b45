package com.eainde.augury.arbitration;

import com.eainde.augury.conflict.ConflictRecord;
import com.eainde.augury.conflict.ConflictTier;
import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Tiebreaking rules for severe conflicts.
 *
 * <p>Matching an arbitrator against a conflicting pair:
 * <ol>
 *   <li>exact judgment match with exactly one side wins that side</li>
 *   <li>otherwise, a non-neutral arbitrator on the same side of neutral as exactly one side wins it</li>
 *   <li>an arbitrator agreeing with both sides is a consensus</li>
 *   <li>anything else is inconclusive</li>
 * </ol>
 * Running the arbitrator is left to the caller; this class only chooses and judges.
 */
@Log4j2
@Component
public class ArbitrationSystem {

    private final ArbitrationSettings settings;

    public ArbitrationSystem(ArbitrationSettings settings) {
        this.settings = settings;
    }

    public ArbitrationSettings settings() {
        return settings;
    }

    public boolean shouldArbitrate(ConflictRecord conflict) {
        return conflict.tier() == ConflictTier.SEVERE;
    }

    public Optional<String> selectArbitrator(QuestionCategory category, Set<String> alreadyUsed) {
        return selectArbitrator(category, alreadyUsed, name -> true);
    }

    /**
     * First theory of the category's priority list that is unused and accepted by {@code eligible}.
     */
    public Optional<String> selectArbitrator(QuestionCategory category, Set<String> alreadyUsed,
                                             Predicate<String> eligible) {
        for (String candidate : settings.priorityFor(category)) {
            if (alreadyUsed.contains(candidate)) {
                continue;
            }
            if (!eligible.test(candidate)) {
                log.debug("Skipping arbitrator {} for {}: not eligible", candidate, category.key());
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    public ArbitrationOutcome arbitrate(TheoryResult arbiter, TheoryResult sideA, TheoryResult sideB) {
        boolean exactA = arbiter.judgment() == sideA.judgment();
        boolean exactB = arbiter.judgment() == sideB.judgment();
        if (exactA != exactB) {
            return exactA
                    ? matched(arbiter, sideA, ArbitrationVerdict.SIDE_A)
                    : matched(arbiter, sideB, ArbitrationVerdict.SIDE_B);
        }

        boolean leaning = arbiter.judgment().side() != Judgment.Side.NEUTRAL;
        boolean sameSideA = leaning && arbiter.judgment().side() == sideA.judgment().side();
        boolean sameSideB = leaning && arbiter.judgment().side() == sideB.judgment().side();
        if (!exactA && sameSideA != sameSideB) {
            return sameSideA
                    ? matched(arbiter, sideA, ArbitrationVerdict.SIDE_A)
                    : matched(arbiter, sideB, ArbitrationVerdict.SIDE_B);
        }

        double meanConfidence = (sideA.confidence() + sideB.confidence()) / 2.0;
        if (exactA || sameSideA) {
            double level = (sideA.level() + sideB.level()) / 2.0;
            double adjusted = Math.min(1.0, meanConfidence + settings.consensusBonus());
            log.info("Arbitrator {} agrees with both {} and {}", arbiter.theoryName(), sideA.theoryName(),
                    sideB.theoryName());
            return new ArbitrationOutcome(arbiter.theoryName(), arbiter, ArbitrationVerdict.BOTH, null,
                    Judgment.fromLevel(level), level, meanConfidence, adjusted);
        }

        double adjusted = Math.min(meanConfidence, settings.inconclusiveConfidenceCap());
        log.info("Arbitrator {} ({}) matches neither {} nor {}; outcome inconclusive", arbiter.theoryName(),
                arbiter.judgment(), sideA.theoryName(), sideB.theoryName());
        return new ArbitrationOutcome(arbiter.theoryName(), arbiter, ArbitrationVerdict.NEITHER, null,
                Judgment.NEUTRAL, Judgment.NEUTRAL.canonicalLevel(), meanConfidence, adjusted);
    }

    private ArbitrationOutcome matched(TheoryResult arbiter, TheoryResult winner, ArbitrationVerdict verdict) {
        double original = winner.confidence();
        double adjusted = Math.min(1.0, Math.max(original + settings.matchBonus(), settings.matchConfidenceFloor()));
        log.info("Arbitrator {} sides with {} ({}); confidence {} -> {}", arbiter.theoryName(), winner.theoryName(),
                winner.judgment(), original, adjusted);
        return new ArbitrationOutcome(arbiter.theoryName(), arbiter, verdict, winner.theoryName(),
                winner.judgment(), winner.level(), original, adjusted);
    }
}
