package com.eainde.augury.verification;

import com.eainde.augury.theory.TheoryResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies verification feedback to theory confidences.
 *
 * <p>Deltas are applied one record at a time, each clamped to [0,1], so a theory questioned
 * twice sees the second delta on top of the clamped first one.</p>
 */
@Log4j2
@Component
public class ConfidenceAdjuster {

    private final Clock clock;

    public ConfidenceAdjuster() {
        this(Clock.systemUTC());
    }

    public ConfidenceAdjuster(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return revised results in the original order, plus one adjustment per record whose theory is present
     */
    public AdjustedResults apply(List<TheoryResult> results, List<VerificationRecord> records) {
        Map<String, TheoryResult> byName = new LinkedHashMap<>();
        results.forEach(r -> byName.put(r.theoryName(), r));

        List<ConfidenceAdjustment> adjustments = new ArrayList<>();
        for (VerificationRecord record : records) {
            String theory = record.question().theoryName();
            TheoryResult current = byName.get(theory);
            if (current == null) {
                log.warn("Ignoring feedback for theory {} which has no result", theory);
                continue;
            }
            TheoryResult revised = current.withConfidence(current.confidence() + record.verdict().delta());
            byName.put(theory, revised);
            adjustments.add(new ConfidenceAdjustment(theory, record.verdict().delta(), record.verdict(),
                    current.confidence(), revised.confidence(), clock.instant()));
            log.info("Confidence of {} {} -> {} ({})", theory, current.confidence(), revised.confidence(),
                    record.verdict());
        }
        return new AdjustedResults(List.copyOf(byName.values()), adjustments);
    }

    public record AdjustedResults(List<TheoryResult> results, List<ConfidenceAdjustment> adjustments) {

        public AdjustedResults {
            results = List.copyOf(results);
            adjustments = List.copyOf(adjustments);
        }
    }
}
