package com.eainde.augury.verification;

/**
 * Form the user's answer to a verification question is expected to take.
 */
public enum AnswerShape {
    YES_NO,
    /** A single choice among {@code choices}. */
    CHOICE,
    /** A four-digit year. */
    YEAR,
    FREE_TEXT
}
