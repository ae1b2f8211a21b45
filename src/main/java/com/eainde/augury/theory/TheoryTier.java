package com.eainde.augury.theory;

/**
 * Execution tier. Theories run in tier order so cheap results surface first.
 */
public enum TheoryTier {
    /** Seed-only theories. */
    FAST,
    /** Birth-data theories. */
    BASIC,
    /** Multi-field, time-sensitive or deep calculations. */
    DEEP
}
