package com.eainde.augury.verification;

/**
 * Classification of an answer to a verification question, with the confidence delta it applies
 * to the questioned theory.
 */
public enum FeedbackVerdict {

    CONFIRMED(0.2),
    PARTIALLY_CONFIRMED(0.1),
    DENIED(-0.15),
    UNKNOWN(0.0);

    private final double delta;

    FeedbackVerdict(double delta) {
        this.delta = delta;
    }

    public double delta() {
        return delta;
    }
}
