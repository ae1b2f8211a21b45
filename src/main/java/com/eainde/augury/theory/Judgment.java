package com.eainde.augury.theory;

/**
 * Ordered verdict scale shared by every theory.
 *
 * <p>Each judgment owns a canonical level and a band of levels:
 * <pre>
 *   level &gt;= 0.85  VERY_FAVORABLE
 *   level &gt;= 0.65  FAVORABLE
 *   level &gt;= 0.35  NEUTRAL
 *   level &gt;= 0.15  UNFAVORABLE
 *   otherwise      VERY_UNFAVORABLE
 * </pre>
 */
public enum Judgment {

    VERY_UNFAVORABLE("very unfavorable", 0.0, Side.NEGATIVE),
    UNFAVORABLE("unfavorable", 0.3, Side.NEGATIVE),
    NEUTRAL("neutral", 0.5, Side.NEUTRAL),
    FAVORABLE("favorable", 0.7, Side.POSITIVE),
    VERY_FAVORABLE("very favorable", 1.0, Side.POSITIVE);

    public enum Side { NEGATIVE, NEUTRAL, POSITIVE }

    private final String label;
    private final double canonicalLevel;
    private final Side side;

    Judgment(String label, double canonicalLevel, Side side) {
        this.label = label;
        this.canonicalLevel = canonicalLevel;
        this.side = side;
    }

    public String label() {
        return label;
    }

    public double canonicalLevel() {
        return canonicalLevel;
    }

    public Side side() {
        return side;
    }

    /**
     * True when the two judgments sit on opposite sides of neutral.
     */
    public boolean opposes(Judgment other) {
        return (side == Side.POSITIVE && other.side == Side.NEGATIVE)
                || (side == Side.NEGATIVE && other.side == Side.POSITIVE);
    }

    public static Judgment fromLevel(double level) {
        if (level >= 0.85) {
            return VERY_FAVORABLE;
        }
        if (level >= 0.65) {
            return FAVORABLE;
        }
        if (level >= 0.35) {
            return NEUTRAL;
        }
        if (level >= 0.15) {
            return UNFAVORABLE;
        }
        return VERY_UNFAVORABLE;
    }
}
