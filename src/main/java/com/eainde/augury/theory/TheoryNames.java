package com.eainde.augury.theory;

/**
 * Registry keys of the built-in theories, grouped by execution tier.
 */
public final class TheoryNames {

    private TheoryNames() {}

    // ── FAST ────────────────────────────────────────────────────────────

    /** Xiao Liu Ren: six palaces counted from three seeds. */
    public static final String XIAOLIU = "xiaoliu";

    /** Character analysis of a single seed character. */
    public static final String CEZI = "cezi";

    /** Plum Blossom numerology: trigrams from seeds. */
    public static final String MEIHUA = "meihua";

    // ── BASIC ───────────────────────────────────────────────────────────

    /** Four Pillars of birth. */
    public static final String BAZI = "bazi";

    /** Purple Star astrology. Needs the birth hour. */
    public static final String ZIWEI = "ziwei";

    // ── DEEP ────────────────────────────────────────────────────────────

    /** Qi Men Dun Jia, cast for the inquiry moment. */
    public static final String QIMEN = "qimen";

    /** Da Liu Ren, cast for the inquiry moment. */
    public static final String DALIUREN = "daliuren";

    /** Six Lines hexagram from seeds. */
    public static final String LIUYAO = "liuyao";
}
