package com.eainde.augury.conversation;

/**
 * A request, detected in free text or received explicitly, to change one field.
 */
public record FieldModification(String field, String rawValue) {
}
