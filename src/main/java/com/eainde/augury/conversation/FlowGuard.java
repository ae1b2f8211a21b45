package com.eainde.augury.conversation;

import com.eainde.augury.error.ExtractionException;
import com.eainde.augury.error.ExtractionTimeoutException;
import com.eainde.augury.error.InputValidationException;
import com.eainde.augury.extraction.FieldExtractor;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.verification.VerificationQuestionGenerator;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stage gatekeeper of a session.
 *
 * <pre>
 *   user turn
 *      │
 *      ├─► skip declarations ("skip", "I don't know my birth hour")
 *      ├─► deterministic validators for every open field of the stage
 *      ├─► extraction, only while required fields are still open
 *      │       (timeout or failure: this turn stays deterministic-only)
 *      ├─► validate extracted values; never overwrite a settled field
 *      └─► progress ─► retry bookkeeping ─► auto-skip after max retries
 * </pre>
 *
 * A stage is left only through {@link #advance}, and only forward.
 */
@Log4j2
@Component
public class FlowGuard {

    private static final Pattern SKIP_PHRASE = Pattern.compile(
            "\\b(skip|don'?t know|do not know|not sure|no idea|can'?t remember|cannot remember|unknown|nothing)\\b");

    /** A turn that is nothing but a skip, e.g. "skip" or "no idea". */
    private static final Pattern BARE_SKIP = Pattern.compile(
            "^\\W*(skip( it)?|pass|none|nothing|no idea|not sure|i don'?t know|don'?t know)\\W*$");

    /** Words that tie a skip phrase to one field. */
    private static final Map<String, List<String>> SKIP_MENTIONS = Map.of(
            FieldNames.BIRTH_HOUR, List.of("hour", "time", "o'clock"),
            FieldNames.CHARACTER, List.of("character", "char", "word"),
            FieldNames.PERSONALITY_TYPE, List.of("mbti", "personality"),
            FieldNames.FAVORITE_COLOR, List.of("color", "colour"),
            FieldNames.CURRENT_DIRECTION, List.of("direction", "facing"),
            FieldNames.BIRTH_TIME_CERTAINTY, List.of("certain", "accurate"));

    private final FieldExtractor fieldExtractor;
    private final TheoryRegistry registry;
    private final ConversationSettings settings;

    public FlowGuard(FieldExtractor fieldExtractor, TheoryRegistry registry, ConversationSettings settings) {
        this.fieldExtractor = fieldExtractor;
        this.registry = registry;
        this.settings = settings;
    }

    // =========================================================================
    //  Turn evaluation
    // =========================================================================

    /**
     * Runs one user turn through the validation pipeline and merges the accepted values
     * into the context. Never changes the stage.
     *
     * @throws IllegalStateException if the current stage does not collect fields
     */
    public TurnEvaluation evaluateTurn(ConversationContext context, String text) {
        ConversationStage stage = context.getStage();
        if (!stage.collectsFields()) {
            throw new IllegalStateException("Stage " + stage + " does not collect fields");
        }
        List<StageRequirement> requirements = StageCatalog.requirements(stage);
        UserInput before = context.getInput();
        UserInput input = before;
        Map<String, FieldCheck> checks = new LinkedHashMap<>();

        // 1. Skip declarations
        Set<String> skips = skipRequests(requirements, input, text);

        // 2. Deterministic validators
        for (StageRequirement requirement : requirements) {
            String field = requirement.field();
            if (input.isSettled(field)) {
                continue;
            }
            FieldCheck check = requirement.validator().detect(field, text);
            if (check.isFound()) {
                input = input.withField(field, check.value());
            } else if (skips.contains(field)) {
                input = input.withSkipped(field);
                check = FieldCheck.skipped(field);
            }
            checks.put(field, check);
        }

        // 3. Extraction for what is still required
        ExtractionStatus extractionStatus = ExtractionStatus.NOT_NEEDED;
        if (hasOpenRequired(requirements, input)) {
            try {
                Map<String, Object> candidates = fieldExtractor.extract(stage, text, input);
                extractionStatus = candidates.isEmpty() ? ExtractionStatus.NOTHING_FOUND : ExtractionStatus.APPLIED;
                input = mergeExtracted(requirements, input, candidates, checks);
            } catch (ExtractionTimeoutException e) {
                log.warn("Extraction timed out in stage {}; continuing with deterministic values", stage);
                extractionStatus = ExtractionStatus.TIMED_OUT;
            } catch (ExtractionException e) {
                log.warn("Extraction failed in stage {}: {}; continuing with deterministic values",
                        stage, e.getMessage());
                extractionStatus = ExtractionStatus.FAILED;
            }
        }

        input = applyBirthTimeCertainty(input);
        context.setInput(input);
        // Results computed before these fields arrived are recomputed in the next pass
        List<String> added = input.fields().stream().filter(f -> !before.has(f)).toList();
        invalidateDependents(context, added);

        // 4. Progress and retries
        StageProgress progress = progress(stage, input);
        List<String> autoSkipped = new ArrayList<>();
        boolean retriesExceeded = false;
        if (!progress.canProceed()) {
            int attempts = context.incrementRetries(stage);
            retriesExceeded = attempts >= settings.maxRetries();
            if (retriesExceeded) {
                for (StageRequirement requirement : requirements) {
                    if (requirement.isRequired() && requirement.skippable() && !input.isSettled(requirement.field())) {
                        input = input.withSkipped(requirement.field());
                        autoSkipped.add(requirement.field());
                    }
                }
                if (!autoSkipped.isEmpty()) {
                    log.info("Auto-skipped {} after {} failed turns in stage {}", autoSkipped, attempts, stage);
                    input = applyBirthTimeCertainty(input);
                    context.setInput(input);
                    progress = progress(stage, input);
                }
            }
        }

        List<String> hints = checks.values().stream()
                .filter(c -> c.status() == FieldCheck.Status.INVALID || c.status() == FieldCheck.Status.AMBIGUOUS)
                .map(FieldCheck::hint)
                .toList();

        log.debug("Turn in stage {}: {} required of {} settled, extraction {}", stage, progress.requiredDone(),
                progress.requiredTotal(), extractionStatus);
        return new TurnEvaluation(stage, List.copyOf(checks.values()), progress, extractionStatus, hints,
                autoSkipped, retriesExceeded);
    }

    private UserInput mergeExtracted(List<StageRequirement> requirements, UserInput input,
                                     Map<String, Object> candidates, Map<String, FieldCheck> checks) {
        UserInput merged = input;
        for (StageRequirement requirement : requirements) {
            String field = requirement.field();
            if (!candidates.containsKey(field) || merged.isSettled(field)) {
                continue;
            }
            FieldCheck check = requirement.validator().validate(field, candidates.get(field));
            if (check.isFound()) {
                merged = merged.withField(field, check.value());
                checks.put(field, check);
            } else {
                log.debug("Discarding extracted {} = {}: {}", field, candidates.get(field), check.status());
                FieldCheck previous = checks.get(field);
                if (previous == null || previous.status() == FieldCheck.Status.ABSENT) {
                    checks.put(field, check);
                }
            }
        }
        return merged;
    }

    private static Set<String> skipRequests(List<StageRequirement> requirements, UserInput input, String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (!SKIP_PHRASE.matcher(lower).find()) {
            return Set.of();
        }
        List<StageRequirement> open = requirements.stream()
                .filter(StageRequirement::skippable)
                .filter(r -> !input.isSettled(r.field()))
                .toList();

        Set<String> mentioned = new LinkedHashSet<>();
        for (StageRequirement requirement : open) {
            List<String> words = SKIP_MENTIONS.getOrDefault(requirement.field(), List.of());
            if (words.stream().anyMatch(lower::contains)) {
                mentioned.add(requirement.field());
            }
        }
        if (!mentioned.isEmpty()) {
            return mentioned;
        }
        if (!lower.contains("skip") && !BARE_SKIP.matcher(lower.trim()).matches()) {
            return Set.of();
        }
        // A bare "skip" covers the skippable required fields only
        Set<String> all = new LinkedHashSet<>();
        open.stream().filter(StageRequirement::isRequired).map(StageRequirement::field).forEach(all::add);
        return all;
    }

    private static boolean hasOpenRequired(List<StageRequirement> requirements, UserInput input) {
        return requirements.stream().anyMatch(r -> r.isRequired() && !input.isSettled(r.field()));
    }

    /** An unknown birth hour implies an unknown birth time, unless the user said otherwise. */
    private static UserInput applyBirthTimeCertainty(UserInput input) {
        if (input.isSkipped(FieldNames.BIRTH_HOUR) && !input.isSettled(FieldNames.BIRTH_TIME_CERTAINTY)) {
            return input.withField(FieldNames.BIRTH_TIME_CERTAINTY, "unknown");
        }
        return input;
    }

    // =========================================================================
    //  Progress and stage transitions
    // =========================================================================

    public StageProgress progress(ConversationContext context) {
        ConversationStage stage = context.getStage();
        if (stage == ConversationStage.VERIFY) {
            return verificationProgress(context);
        }
        return progress(stage, context.getInput());
    }

    /** Field completion of a collecting stage; other stages report no fields and may proceed. */
    public StageProgress progress(ConversationStage stage, UserInput input) {
        List<StageRequirement> requirements = StageCatalog.requirements(stage);
        int requiredTotal = 0;
        int requiredDone = 0;
        int optionalTotal = 0;
        int optionalDone = 0;
        List<String> missing = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<StageProgress.Item> items = new ArrayList<>();

        for (StageRequirement requirement : requirements) {
            String field = requirement.field();
            StageProgress.ItemState state = input.has(field) ? StageProgress.ItemState.DONE
                    : input.isSkipped(field) ? StageProgress.ItemState.SKIPPED
                    : StageProgress.ItemState.OPEN;
            if (state == StageProgress.ItemState.SKIPPED) {
                skipped.add(field);
            }
            if (requirement.isRequired()) {
                requiredTotal++;
                if (state == StageProgress.ItemState.OPEN) {
                    missing.add(field);
                } else {
                    requiredDone++;
                }
            } else {
                optionalTotal++;
                if (state == StageProgress.ItemState.DONE) {
                    optionalDone++;
                }
            }
            items.add(new StageProgress.Item(field, requirement.label(), requirement.isRequired(), state));
        }
        return new StageProgress(stage, requiredTotal, requiredDone, optionalTotal, optionalDone, missing, skipped,
                items, missing.isEmpty());
    }

    private static StageProgress verificationProgress(ConversationContext context) {
        int total = Math.max(context.getQuestions().size(), VerificationQuestionGenerator.QUESTION_COUNT);
        int answered = context.records().size();
        List<StageProgress.Item> items = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (int i = 1; i <= total; i++) {
            boolean done = i <= answered;
            String field = "verification_" + i;
            items.add(new StageProgress.Item(field, "verification question " + i, true,
                    done ? StageProgress.ItemState.DONE : StageProgress.ItemState.OPEN));
            if (!done) {
                missing.add(field);
            }
        }
        return new StageProgress(ConversationStage.VERIFY, total, Math.min(answered, total), 0, 0, missing,
                List.of(), items, missing.isEmpty());
    }

    /**
     * Moves to the next stage when the current one allows it.
     *
     * @return true if the stage changed
     * @throws IllegalStateException if the session is already completed
     */
    public boolean advance(ConversationContext context) {
        ConversationStage current = context.getStage();
        if (current.isTerminal()) {
            throw new IllegalStateException("Session " + context.getSessionId() + " is already completed");
        }
        if (!canLeave(context)) {
            log.debug("Stage {} of session {} cannot be left yet", current, context.getSessionId());
            return false;
        }
        ConversationStage next = current.next();
        context.markCompleted(current);
        context.resetRetries(current);
        context.setStage(next);
        log.info("Session {} moved {} -> {}", context.getSessionId(), current, next);
        return true;
    }

    private boolean canLeave(ConversationContext context) {
        return switch (context.getStage()) {
            case INIT -> context.getInput().has(FieldNames.QUESTION_TEXT);
            case ICEBREAK, DEEPEN, COLLECT, VERIFY -> progress(context).canProceed();
            case REPORT -> context.getReport() != null;
            case QA -> true;
            case COMPLETED -> false;
        };
    }

    // =========================================================================
    //  Explicit modification
    // =========================================================================

    /**
     * Replaces one field, validated like any other value, and requeues the cached theories
     * that depend on it. The stage does not change.
     *
     * @throws InputValidationException if the field is unknown or the value does not validate
     */
    public ModificationResult modifyField(ConversationContext context, String field, Object rawValue) {
        StageRequirement requirement = StageCatalog.find(field)
                .orElseThrow(() -> new InputValidationException(field, "this field cannot be modified"));
        FieldCheck check = requirement.validator().validate(field, rawValue);
        if (!check.isFound()) {
            String reason = check.hint() != null ? check.hint() : "no valid " + requirement.label() + " found";
            throw new InputValidationException(field, reason);
        }

        UserInput input = context.getInput();
        Object oldValue = input.get(field).orElse(null);
        Object newValue = check.value();
        if (newValue.equals(oldValue)) {
            return new ModificationResult(field, oldValue, newValue, List.of(), context.getStage());
        }

        context.setInput(input.replaceField(field, newValue));
        Set<String> invalidated = invalidateDependents(context, List.of(field));
        if (context.getReport() != null) {
            context.setReportStale(true);
        }
        log.info("Session {} modified {}: {} -> {}; invalidated {}", context.getSessionId(), field, oldValue,
                newValue, invalidated);
        return new ModificationResult(field, oldValue, newValue, List.copyOf(invalidated), context.getStage());
    }

    /** Marks cached theories that read any of the fields as stale; uncached theories are untouched. */
    private Set<String> invalidateDependents(ConversationContext context, List<String> fields) {
        if (fields.isEmpty()) {
            return Set.of();
        }
        List<String> dependents = registry.descriptors().stream()
                .filter(d -> fields.stream().anyMatch(d::dependsOn))
                .map(TheoryDescriptor::getName)
                .toList();
        return context.invalidate(dependents);
    }
}
