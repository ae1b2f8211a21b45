package com.eainde.augury.error;

/**
 * One theory runner failed. The theory is dropped from the pass; the pass continues.
 */
public class CalculationException extends AuguryException {

    private final String theoryName;

    public CalculationException(String theoryName, String message) {
        super("[" + theoryName + "] " + message);
        this.theoryName = theoryName;
    }

    public CalculationException(String theoryName, String message, Throwable cause) {
        super("[" + theoryName + "] " + message, cause);
        this.theoryName = theoryName;
    }

    public String getTheoryName() {
        return theoryName;
    }
}
