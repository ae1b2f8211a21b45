package com.eainde.augury.report;

import com.eainde.augury.conflict.ConflictRecord;
import com.eainde.augury.conflict.ConflictTier;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.verification.ConfidenceAdjustment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Answers follow-up questions about a finished report. Uses the chat model when one is
 * configured and falls back to a summary built from the report itself.
 */
@Log4j2
@Component
public class ReportAdvisor {

    private final ReportQaAssistant assistant;
    private final ObjectMapper objectMapper;

    @Autowired
    public ReportAdvisor(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        this(Optional.ofNullable(chatModel.getIfAvailable())
                .map(model -> AiServices.builder(ReportQaAssistant.class).chatModel(model).build())
                .orElse(null), objectMapper);
    }

    ReportAdvisor(ReportQaAssistant assistant, ObjectMapper objectMapper) {
        this.assistant = assistant;
        this.objectMapper = objectMapper;
    }

    public String answer(ComprehensiveReport report, String question) {
        if (assistant != null) {
            try {
                String reply = assistant.answer(objectMapper.writeValueAsString(report), question);
                if (reply != null && !reply.isBlank()) {
                    return reply.trim();
                }
                log.warn("Report assistant returned an empty answer; using summary");
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize report {} for the assistant: {}", report.reportId(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Report assistant failed for report {}: {}", report.reportId(), e.getMessage());
            }
        }
        return summarize(report, question);
    }

    // =========================================================================
    //  Deterministic answers
    // =========================================================================

    String summarize(ComprehensiveReport report, String question) {
        String lower = question == null ? "" : question.toLowerCase(Locale.ROOT);

        for (TheoryResult result : report.results()) {
            if (lower.contains(result.theoryName())) {
                return String.format(Locale.ROOT, "%s reads %s with confidence %.0f%%. %s", result.theoryName(),
                        label(result.judgment().name()), result.confidence() * 100, result.interpretation()).trim();
            }
        }

        if (lower.contains("conflict") || lower.contains("disagree") || lower.contains("why")) {
            return explainConflicts(report);
        }

        if (lower.contains("confiden") || lower.contains("verif") || lower.contains("calibrat")) {
            List<ConfidenceAdjustment> adjustments = report.adjustments();
            if (adjustments.isEmpty()) {
                return "No calibration was applied to the readings.";
            }
            StringBuilder sb = new StringBuilder("Your answers recalibrated the readings:");
            for (ConfidenceAdjustment adjustment : adjustments) {
                sb.append(String.format(Locale.ROOT, " %s %.2f -> %.2f (%s);", adjustment.theoryName(),
                        adjustment.before(), adjustment.after(), label(adjustment.verdict().name())));
            }
            return sb.substring(0, sb.length() - 1) + ".";
        }

        if (lower.contains("limit") || lower.contains("accura") || lower.contains("reliab")) {
            return report.limitations().isEmpty()
                    ? "No particular limitations were found for this reading."
                    : String.join(" ", report.limitations());
        }

        FinalVerdict verdict = report.verdict();
        String advice = report.finalResolution().recommendations().stream().findFirst().orElse("");
        return String.format(Locale.ROOT, "Overall the outlook is %s (confidence %.0f%%) based on %d reading(s). %s",
                label(verdict.judgment().name()), verdict.confidence() * 100, report.results().size(), advice).trim();
    }

    private static String explainConflicts(ComprehensiveReport report) {
        List<ConflictRecord> severe = report.finalResolution().conflicts().stream()
                .filter(c -> c.tier() == ConflictTier.SEVERE)
                .toList();
        if (severe.isEmpty()) {
            return "The readings broadly agree. " + report.finalResolution().summary();
        }
        StringBuilder sb = new StringBuilder("The readings disagree: ");
        for (ConflictRecord conflict : severe) {
            sb.append(conflict.theoryA()).append(" vs ").append(conflict.theoryB()).append("; ");
        }
        if (report.finalResolution().arbitration() != null) {
            sb.append(report.finalResolution().arbitration().arbitratorName()).append(" was consulted as tiebreaker.");
        } else {
            sb.append("no tiebreaker was available, so the verdict was kept conservative.");
        }
        return sb.toString();
    }

    private static String label(String constant) {
        return constant.toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
