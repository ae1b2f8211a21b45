package com.eainde.augury.conversation;

import java.io.Serializable;

/**
 * Outcome of validating one field against one user turn.
 *
 * @param field  field name
 * @param status what the validator concluded
 * @param value  normalized value when {@code FOUND}, otherwise null
 * @param hint   re-prompt hint for {@code INVALID} and {@code AMBIGUOUS}, otherwise null
 */
public record FieldCheck(String field, Status status, Object value, String hint) implements Serializable {

    public enum Status { FOUND, ABSENT, INVALID, AMBIGUOUS, SKIPPED }

    public static FieldCheck found(String field, Object value) {
        return new FieldCheck(field, Status.FOUND, value, null);
    }

    public static FieldCheck absent(String field) {
        return new FieldCheck(field, Status.ABSENT, null, null);
    }

    public static FieldCheck invalid(String field, String hint) {
        return new FieldCheck(field, Status.INVALID, null, hint);
    }

    public static FieldCheck ambiguous(String field, String hint) {
        return new FieldCheck(field, Status.AMBIGUOUS, null, hint);
    }

    public static FieldCheck skipped(String field) {
        return new FieldCheck(field, Status.SKIPPED, null, null);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
