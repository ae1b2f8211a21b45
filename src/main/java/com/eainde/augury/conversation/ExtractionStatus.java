package com.eainde.augury.conversation;

/**
 * What the extraction step contributed to a turn.
 */
public enum ExtractionStatus {
    /** Deterministic validators settled every required field. */
    NOT_NEEDED,
    APPLIED,
    NOTHING_FOUND,
    /** Degraded to deterministic-only for this turn. */
    TIMED_OUT,
    /** Degraded to deterministic-only for this turn. */
    FAILED
}
