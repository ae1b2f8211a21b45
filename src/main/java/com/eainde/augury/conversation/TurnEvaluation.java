package com.eainde.augury.conversation;

import java.util.List;

/**
 * Result of running one user turn through the validation pipeline.
 *
 * @param stage            stage evaluated
 * @param checks           per-field outcome for fields still open before the turn
 * @param progress         stage completion after the turn
 * @param extractionStatus contribution of the extraction step
 * @param hints            re-prompt hints for invalid or ambiguous values
 * @param autoSkipped      skippable fields skipped because the retry limit was reached
 * @param retriesExceeded  the retry limit was reached on this turn
 */
public record TurnEvaluation(
        ConversationStage stage,
        List<FieldCheck> checks,
        StageProgress progress,
        ExtractionStatus extractionStatus,
        List<String> hints,
        List<String> autoSkipped,
        boolean retriesExceeded
) {

    public TurnEvaluation {
        checks = List.copyOf(checks);
        hints = List.copyOf(hints);
        autoSkipped = List.copyOf(autoSkipped);
    }

    public boolean canProceed() {
        return progress.canProceed();
    }
}
