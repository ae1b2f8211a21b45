package com.eainde.augury.theory;

/**
 * Keys of the fields a {@link UserInput} can carry.
 *
 * <pre>
 * ICEBREAK : question_category, numbers
 * DEEPEN   : question_description, character
 * COLLECT  : birth_year, birth_month, birth_day, birth_hour, gender,
 *            personality_type, favorite_color, current_direction, birth_time_certainty
 * (always) : question_text, inquiry_time
 * </pre>
 */
public final class FieldNames {

    private FieldNames() {}

    // ── Session ─────────────────────────────────────────────────────────

    /** Raw question the session was started with. */
    public static final String QUESTION_TEXT = "question_text";

    /** Moment the question was asked. Set at session start. */
    public static final String INQUIRY_TIME = "inquiry_time";

    // ── ICEBREAK ────────────────────────────────────────────────────────

    /** {@link QuestionCategory} key. */
    public static final String QUESTION_CATEGORY = "question_category";

    /** Three seed digits 1-9. */
    public static final String NUMBERS = "numbers";

    // ── DEEPEN ──────────────────────────────────────────────────────────

    public static final String QUESTION_DESCRIPTION = "question_description";

    /** Single seed character. */
    public static final String CHARACTER = "character";

    // ── COLLECT ─────────────────────────────────────────────────────────

    public static final String BIRTH_YEAR = "birth_year";
    public static final String BIRTH_MONTH = "birth_month";
    public static final String BIRTH_DAY = "birth_day";
    public static final String BIRTH_HOUR = "birth_hour";
    public static final String GENDER = "gender";

    /** Four-letter MBTI type. */
    public static final String PERSONALITY_TYPE = "personality_type";

    public static final String FAVORITE_COLOR = "favorite_color";
    public static final String CURRENT_DIRECTION = "current_direction";

    /** certain / uncertain / unknown. */
    public static final String BIRTH_TIME_CERTAINTY = "birth_time_certainty";
}
