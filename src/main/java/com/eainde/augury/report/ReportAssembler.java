package com.eainde.augury.report;

import com.eainde.augury.analysis.AnalysisPass;
import com.eainde.augury.arbitration.ArbitrationStatus;
import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.selection.TheoryFitness;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.verification.ConfidenceAdjustment;
import com.eainde.augury.verification.FeedbackVerdict;
import com.eainde.augury.verification.VerificationRecord;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds the {@link ComprehensiveReport} from the artifacts of a finished session and renders
 * it as the final reply.
 */
@Log4j2
@Component
public class ReportAssembler {

    private final Clock clock;

    public ReportAssembler() {
        this(Clock.systemUTC());
    }

    public ReportAssembler(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param input            everything collected in the session
     * @param category         question category
     * @param initialPass      full pass that ran before verification
     * @param finalResults     results after confidence adjustment
     * @param finalResolution  resolution over {@code finalResults}
     * @param adjustments      confidence changes, in application order
     * @param records          answered verification questions
     */
    public ComprehensiveReport assemble(UserInput input, QuestionCategory category, AnalysisPass initialPass,
                                        List<TheoryResult> finalResults, ConflictResolution finalResolution,
                                        List<ConfidenceAdjustment> adjustments, List<VerificationRecord> records) {
        Set<String> ran = finalResults.stream().map(TheoryResult::theoryName).collect(Collectors.toSet());
        List<TheoryFitness> selected = initialPass.selection().ranking().stream()
                .filter(f -> ran.contains(f.theoryName()))
                .sorted((a, b) -> Integer.compare(indexOf(finalResults, a.theoryName()), indexOf(finalResults, b.theoryName())))
                .toList();

        List<String> skipped = List.copyOf(input.skippedFields());
        ComprehensiveReport report = new ComprehensiveReport(
                UUID.randomUUID().toString(),
                clock.instant(),
                input.getString(FieldNames.QUESTION_TEXT).orElse(""),
                category.key(),
                selected,
                finalResults,
                initialPass.resolution(),
                finalResolution,
                adjustments,
                records,
                FinalVerdict.of(finalResolution),
                skipped,
                limitations(input, initialPass, finalResults, finalResolution, records));
        log.info("Assembled report {}: {} at level {} with confidence {}", report.reportId(),
                finalResolution.judgment(), finalResolution.level(), finalResolution.confidence());
        return report;
    }

    private static int indexOf(List<TheoryResult> results, String name) {
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i).theoryName().equals(name)) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }

    List<String> limitations(UserInput input, AnalysisPass initialPass, List<TheoryResult> finalResults,
                             ConflictResolution finalResolution, List<VerificationRecord> records) {
        List<String> limitations = new ArrayList<>();
        if (input.isSkipped(FieldNames.BIRTH_HOUR)) {
            limitations.add("Birth hour unknown: birth-chart readings are less precise and weighted down.");
        }
        input.skippedFields().stream()
                .filter(f -> !FieldNames.BIRTH_HOUR.equals(f))
                .forEach(f -> limitations.add("Not provided: " + f.replace('_', ' ') + "."));

        initialPass.failures().forEach((theory, reason) ->
                limitations.add("Reading " + theory + " could not be completed (" + reason + ")."));

        if (finalResults.size() == 1) {
            limitations.add("Only one reading contributed; no cross-check was possible.");
        }

        ArbitrationStatus status = finalResolution.arbitrationStatus();
        if (status == ArbitrationStatus.INCONCLUSIVE) {
            limitations.add("The readings disagree strongly and the tiebreaker sided with neither; "
                    + "the verdict leans neutral.");
        } else if (status == ArbitrationStatus.UNAVAILABLE) {
            limitations.add("The readings disagree strongly and no tiebreaker was available; "
                    + "a conservative verdict is shown.");
        }

        if (!records.isEmpty() && records.stream().allMatch(r -> r.verdict() == FeedbackVerdict.UNKNOWN)) {
            limitations.add("Verification answers were inconclusive; confidences were not recalibrated.");
        }
        if (finalResolution.confidence() < 0.5) {
            limitations.add("Overall confidence is low; treat this as one perspective among others.");
        }
        return limitations;
    }

    /** Plain-text rendering used as the final reply. */
    public String render(ComprehensiveReport report) {
        StringBuilder sb = new StringBuilder();
        FinalVerdict verdict = report.verdict();
        sb.append("=== Reading for: ").append(report.question()).append(" ===\n");
        sb.append(String.format(Locale.ROOT, "Verdict: %s (level %.2f, confidence %.0f%%)%n",
                label(verdict.judgment().name()), verdict.level(), verdict.confidence() * 100));
        sb.append(report.finalResolution().summary()).append('\n');

        sb.append("\nReadings:\n");
        for (TheoryResult result : report.results()) {
            sb.append(String.format(Locale.ROOT, "- %s: %s, confidence %.0f%%", result.theoryName(),
                    label(result.judgment().name()), result.confidence() * 100));
            if (!result.interpretation().isBlank()) {
                sb.append(". ").append(result.interpretation());
            }
            sb.append('\n');
        }

        if (!report.adjustments().isEmpty()) {
            sb.append("\nCalibration:\n");
            for (ConfidenceAdjustment adjustment : report.adjustments()) {
                sb.append(String.format(Locale.ROOT, "- %s: %.2f -> %.2f (%s)%n", adjustment.theoryName(),
                        adjustment.before(), adjustment.after(), label(adjustment.verdict().name())));
            }
        }

        List<String> advice = report.finalResolution().recommendations();
        if (!advice.isEmpty()) {
            sb.append("\nRecommendations:\n");
            advice.forEach(r -> sb.append("- ").append(r).append('\n'));
        }
        if (!report.limitations().isEmpty()) {
            sb.append("\nLimitations:\n");
            report.limitations().forEach(l -> sb.append("- ").append(l).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private static String label(String constant) {
        return constant.toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
