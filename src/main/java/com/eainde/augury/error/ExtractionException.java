package com.eainde.augury.error;

/**
 * Base for failures of the natural-language extraction collaborator.
 * A turn that hits one of these falls back to the deterministic validators only.
 */
public class ExtractionException extends AuguryException {

    private final String stage;

    public ExtractionException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public ExtractionException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
