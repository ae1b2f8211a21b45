package com.eainde.augury.conversation;

/**
 * Deterministic validation of one field.
 */
public interface FieldValidator {

    /**
     * Looks for the field in a raw user turn (pattern and range checks only).
     */
    FieldCheck detect(String field, String text);

    /**
     * Validates a candidate value coming from extraction or an explicit modification.
     */
    FieldCheck validate(String field, Object candidate);
}
