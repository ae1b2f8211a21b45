package com.eainde.augury.conversation;

import com.eainde.augury.analysis.AnalysisPass;
import com.eainde.augury.analysis.AnalysisService;
import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.error.AuguryException;
import com.eainde.augury.error.InputValidationException;
import com.eainde.augury.error.InsufficientTheoriesException;
import com.eainde.augury.report.ComprehensiveReport;
import com.eainde.augury.report.ReportAdvisor;
import com.eainde.augury.report.ReportAssembler;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.verification.AnswerClassifier;
import com.eainde.augury.verification.ConfidenceAdjuster;
import com.eainde.augury.verification.FeedbackVerdict;
import com.eainde.augury.verification.VerificationQuestion;
import com.eainde.augury.verification.VerificationQuestionGenerator;
import com.eainde.augury.verification.VerificationRecord;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives a session from the first prompt to the closing message.
 *
 * <pre>
 *   ICEBREAK ─► DEEPEN ─► COLLECT ─► VERIFY ─► REPORT ─► QA ─► COMPLETED
 *      │           │          │          │          │
 *  quick pass  quick pass  full pass  3 answers  adjust, re-resolve, assemble
 * </pre>
 *
 * Callers hold the session lock for the whole call. Errors never leave a turn: they come
 * back as a request for more or different information.
 */
@Log4j2
@Component
public class ConversationEngine {

    private static final Set<String> CLOSING_WORDS = Set.of("done", "bye", "goodbye", "exit", "quit", "finish", "end");

    private final FlowGuard flowGuard;
    private final ModificationDetector modificationDetector;
    private final AnalysisService analysisService;
    private final VerificationQuestionGenerator questionGenerator;
    private final AnswerClassifier answerClassifier;
    private final ConfidenceAdjuster confidenceAdjuster;
    private final ReportAssembler reportAssembler;
    private final ReportAdvisor reportAdvisor;

    public ConversationEngine(FlowGuard flowGuard,
                              ModificationDetector modificationDetector,
                              AnalysisService analysisService,
                              VerificationQuestionGenerator questionGenerator,
                              AnswerClassifier answerClassifier,
                              ConfidenceAdjuster confidenceAdjuster,
                              ReportAssembler reportAssembler,
                              ReportAdvisor reportAdvisor) {
        this.flowGuard = flowGuard;
        this.modificationDetector = modificationDetector;
        this.analysisService = analysisService;
        this.questionGenerator = questionGenerator;
        this.answerClassifier = answerClassifier;
        this.confidenceAdjuster = confidenceAdjuster;
        this.reportAssembler = reportAssembler;
        this.reportAdvisor = reportAdvisor;
    }

    /**
     * Leaves INIT and returns the opening prompt.
     *
     * @throws IllegalStateException if the context has no question or was already started
     */
    public TurnReply start(ConversationContext context) {
        if (context.getStage() != ConversationStage.INIT || !flowGuard.advance(context)) {
            throw new IllegalStateException("Session " + context.getSessionId() + " cannot be started");
        }
        String message = "Welcome. " + StageCatalog.prompt(ConversationStage.ICEBREAK);
        context.addHistory(HistoryEntry.Role.SYSTEM, message);
        return TurnReply.prompt(context.getStage(), message);
    }

    public TurnReply handleTurn(ConversationContext context, String text) {
        if (context.getStage().isTerminal()) {
            return TurnReply.closed("This session has ended. Start a new one to ask another question.");
        }
        if (context.getStage() == ConversationStage.INIT) {
            throw new IllegalStateException("Session " + context.getSessionId() + " has not been started");
        }
        String turn = text == null ? "" : text.trim();
        context.addHistory(HistoryEntry.Role.USER, turn);

        TurnReply reply;
        try {
            reply = modificationDetector.detect(turn)
                    .flatMap(modification -> applyModification(context, modification))
                    .orElseGet(() -> dispatch(context, turn));
        } catch (InsufficientTheoriesException e) {
            log.info("Session {} needs more input in stage {}: {}", context.getSessionId(), context.getStage(),
                    e.getMissingFields());
            reply = needMoreInformation(context, e.getMissingFields());
        } catch (AuguryException e) {
            log.warn("Turn of session {} failed in stage {}: {}", context.getSessionId(), context.getStage(),
                    e.getMessage(), e);
            reply = needMoreInformation(context, List.of());
        }
        context.addHistory(HistoryEntry.Role.SYSTEM, reply.message());
        return reply;
    }

    private TurnReply dispatch(ConversationContext context, String text) {
        return switch (context.getStage()) {
            case ICEBREAK, DEEPEN, COLLECT -> collect(context, text);
            case VERIFY -> verify(context, text);
            case REPORT -> publishReport(context);
            case QA -> answer(context, text);
            case INIT, COMPLETED -> throw new IllegalStateException("No turn handling in stage " + context.getStage());
        };
    }

    // =========================================================================
    //  Modification
    // =========================================================================

    /**
     * Explicit change of one field, outside the regular flow.
     *
     * @throws InputValidationException if the value does not validate
     */
    public ModificationResult modify(ConversationContext context, String field, Object value) {
        if (context.getStage().isTerminal()) {
            throw new IllegalStateException("Session " + context.getSessionId() + " has ended");
        }
        ModificationResult result = flowGuard.modifyField(context, field, value);
        recomputeDuringVerification(context, result);
        return result;
    }

    /**
     * A change request found in free text. Empty when the turn should be handled normally instead,
     * which is the case for an invalid value while fields are being collected: the text is then
     * more likely an ordinary answer than a modification.
     */
    private Optional<TurnReply> applyModification(ConversationContext context, FieldModification modification) {
        ModificationResult result;
        try {
            result = flowGuard.modifyField(context, modification.field(), modification.rawValue());
        } catch (InputValidationException e) {
            if (context.getStage().collectsFields()) {
                log.debug("Ignoring modification of {}: {}", modification.field(), e.getReason());
                return Optional.empty();
            }
            return Optional.of(TurnReply.prompt(context.getStage(),
                    "I could not use that value for " + modification.field().replace('_', ' ') + ". " + e.getReason()));
        }

        recomputeDuringVerification(context, result);
        ConversationStage stage = context.getStage();
        if (stage.collectsFields()) {
            StageProgress progress = flowGuard.progress(context);
            if (progress.canProceed()) {
                return Optional.of(completeStage(context, result.describe()));
            }
            return Optional.of(TurnReply.missing(stage, result.describe() + "\n\n" + progress.render(), progress,
                    progress.missing()));
        }
        String message = result.describe();
        if (context.isReportStale()) {
            message += " Say \"report\" to see the updated report.";
        } else if (stage == ConversationStage.VERIFY && context.pendingQuestion() != null) {
            message += "\n\n" + context.pendingQuestion().render();
        }
        return Optional.of(TurnReply.prompt(stage, message));
    }

    // =========================================================================
    //  Collecting stages
    // =========================================================================

    private TurnReply collect(ConversationContext context, String text) {
        TurnEvaluation evaluation = flowGuard.evaluateTurn(context, text);
        String note = evaluation.autoSkipped().isEmpty() ? ""
                : "Let's continue without " + labels(evaluation.autoSkipped()) + ".";
        if (evaluation.canProceed()) {
            return completeStage(context, note);
        }
        return followUp(context, evaluation, note);
    }

    private TurnReply followUp(ConversationContext context, TurnEvaluation evaluation, String note) {
        StageProgress progress = evaluation.progress();
        StringBuilder message = new StringBuilder();
        if (!note.isEmpty()) {
            message.append(note).append("\n\n");
        }
        message.append("I still need: ").append(labels(progress.missing())).append(".\n\n");
        message.append(progress.render());
        evaluation.hints().forEach(hint -> message.append("\n").append(hint));
        if (evaluation.retriesExceeded()) {
            message.append("\n\nFor example: ").append(StageCatalog.example(evaluation.stage()));
        }
        return TurnReply.missing(evaluation.stage(), message.toString(), progress, progress.missing());
    }

    private TurnReply completeStage(ConversationContext context, String note) {
        ConversationStage finished = context.getStage();
        StringBuilder message = new StringBuilder();
        if (!note.isEmpty()) {
            message.append(note).append("\n\n");
        }

        if (finished == ConversationStage.COLLECT) {
            // Full pass first: if it cannot run, the session stays in COLLECT
            AnalysisPass pass = runPass(context);
            context.setInitialPass(pass);
            List<VerificationQuestion> questions = questionGenerator.generate(pass.results(), context.category());
            context.setQuestions(questions);
            flowGuard.advance(context);
            message.append("Initial reading: ").append(describe(pass.resolution())).append("\n\n")
                    .append(StageCatalog.prompt(ConversationStage.VERIFY)).append("\n\n")
                    .append(questions.get(0).render());
            return TurnReply.prompt(context.getStage(), message.toString());
        }

        flowGuard.advance(context);
        quickReading(context).ifPresent(reading -> message.append(reading).append("\n\n"));
        message.append(StageCatalog.prompt(context.getStage()));
        return TurnReply.prompt(context.getStage(), message.toString());
    }

    /** Preliminary pass with whatever theories are eligible so far. */
    private Optional<String> quickReading(ConversationContext context) {
        try {
            AnalysisPass pass = runPass(context);
            context.setPreliminaryPass(pass);
            return Optional.of("Quick reading from " + String.join(", ", pass.selection().names()) + ": "
                    + describe(pass.resolution()));
        } catch (InsufficientTheoriesException e) {
            log.info("No preliminary reading for session {} yet; missing {}", context.getSessionId(),
                    e.getMissingFields());
            return Optional.empty();
        }
    }

    /**
     * Reruns the theories of the full pass that a modification invalidated.
     *
     * @return names of the recomputed theories, empty when the full pass is still current
     */
    private Set<String> refreshInitialPass(ConversationContext context) {
        AnalysisPass initial = context.getInitialPass();
        if (initial == null) {
            return Set.of();
        }
        Set<String> stale = initial.results().stream()
                .map(TheoryResult::theoryName)
                .filter(context.staleTheories()::contains)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!stale.isEmpty()) {
            log.info("Recomputing {} for session {}", stale, context.getSessionId());
            context.setInitialPass(runPass(context));
        }
        return stale;
    }

    /** Unanswered questions are drawn again from the recomputed results; answered ones are kept. */
    private void recomputeDuringVerification(ConversationContext context, ModificationResult result) {
        if (context.getStage() != ConversationStage.VERIFY || result.invalidated().isEmpty()
                || refreshInitialPass(context).isEmpty()) {
            return;
        }
        int answered = context.records().size();
        List<VerificationQuestion> fresh = questionGenerator.generate(context.getInitialPass().results(),
                context.category());
        List<VerificationQuestion> questions = new ArrayList<>(context.getQuestions().subList(0, answered));
        questions.addAll(fresh.subList(Math.min(answered, fresh.size()), fresh.size()));
        context.setQuestions(questions);
    }

    private AnalysisPass runPass(ConversationContext context) {
        AnalysisPass pass = analysisService.analyze(context.getInput(), context.category(), context.cachedResults(),
                context.staleTheories());
        context.cacheResults(pass.results());
        return pass;
    }

    // =========================================================================
    //  Verification and report
    // =========================================================================

    private TurnReply verify(ConversationContext context, String text) {
        VerificationQuestion question = context.pendingQuestion();
        if (question == null) {
            return publishReport(context);
        }
        FeedbackVerdict verdict = answerClassifier.classify(question, text);
        context.addRecord(new VerificationRecord(question, text, verdict));
        log.info("Session {} answered verification {} for {}: {}", context.getSessionId(), question.index(),
                question.theoryName(), verdict);

        VerificationQuestion next = context.pendingQuestion();
        if (next != null) {
            return TurnReply.prompt(context.getStage(), "Thank you.\n\n" + next.render());
        }
        flowGuard.advance(context);
        return publishReport(context);
    }

    private TurnReply publishReport(ConversationContext context) {
        ComprehensiveReport report = buildReport(context);
        if (context.getStage() == ConversationStage.REPORT) {
            flowGuard.advance(context);
        }
        String message = reportAssembler.render(report) + "\n\n" + StageCatalog.prompt(ConversationStage.QA);
        return TurnReply.finalReport(context.getStage(), message, report);
    }

    /**
     * Applies the verification feedback to the initial results, resolves again and assembles the report.
     */
    private ComprehensiveReport buildReport(ConversationContext context) {
        if (context.getInitialPass() == null) {
            throw new IllegalStateException("Session " + context.getSessionId() + " has no analysis to report");
        }
        refreshInitialPass(context);
        AnalysisPass initial = context.getInitialPass();
        ConfidenceAdjuster.AdjustedResults adjusted = confidenceAdjuster.apply(initial.results(), context.records());
        ConflictResolution resolution = analysisService.reresolve(adjusted.results(), context.getInput(),
                context.category());
        context.setAdjustments(adjusted.adjustments());
        context.setFinalResolution(resolution);

        ComprehensiveReport report = reportAssembler.assemble(context.getInput(), context.category(), initial,
                adjusted.results(), resolution, adjusted.adjustments(), context.records());
        context.setReport(report);
        context.setReportStale(false);
        return report;
    }

    // =========================================================================
    //  Q&A
    // =========================================================================

    private TurnReply answer(ConversationContext context, String text) {
        String lower = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z ]", "").trim();
        if (CLOSING_WORDS.contains(lower) || lower.startsWith("bye") || lower.endsWith(" bye")) {
            flowGuard.advance(context);
            return TurnReply.closed("Thank you for consulting. Take care.");
        }
        if (lower.contains("report")) {
            if (context.isReportStale()) {
                log.info("Refreshing stale report of session {}", context.getSessionId());
            }
            return publishReport(context);
        }

        String reply = reportAdvisor.answer(context.getReport(), text);
        if (context.isReportStale()) {
            reply += "\n\n(Some of your details changed; say \"report\" for an updated report.)";
        }
        return TurnReply.prompt(context.getStage(), reply);
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private TurnReply needMoreInformation(ConversationContext context, List<String> missingFields) {
        StringBuilder message = new StringBuilder("I need a little more information to continue.");
        if (!missingFields.isEmpty()) {
            message.append(" Could you tell me your ").append(labels(missingFields)).append('?');
        } else {
            message.append(' ').append(StageCatalog.prompt(context.getStage()));
        }
        return TurnReply.missing(context.getStage(), message.toString().trim(), null, missingFields);
    }

    private static String describe(ConflictResolution resolution) {
        return String.format(Locale.ROOT, "%s (confidence %.0f%%)",
                resolution.judgment().name().toLowerCase(Locale.ROOT).replace('_', ' '), resolution.confidence() * 100);
    }

    private static String labels(List<String> fields) {
        return fields.stream()
                .map(field -> StageCatalog.find(field).map(StageRequirement::label).orElse(field.replace('_', ' ')))
                .collect(Collectors.joining(", "));
    }
}
