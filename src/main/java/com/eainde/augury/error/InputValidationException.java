package com.eainde.augury.error;

/**
 * A field value is malformed or out of range. Always recovered by re-prompting the user.
 */
public class InputValidationException extends AuguryException {

    private final String field;
    private final String reason;

    public InputValidationException(String field, String reason) {
        super("Invalid value for field '" + field + "': " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
