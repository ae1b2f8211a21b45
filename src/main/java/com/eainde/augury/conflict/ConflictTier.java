package com.eainde.augury.conflict;

/**
 * Severity of disagreement between two results, mildest first.
 */
public enum ConflictTier {
    CONSISTENT(1),
    MINOR(2),
    SIGNIFICANT(3),
    /** Opposite sides of neutral, or a gap beyond the significant threshold. */
    SEVERE(4);

    private final int level;

    ConflictTier(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
