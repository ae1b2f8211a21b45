package com.eainde.augury.theory;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the fields collected so far in one session.
 *
 * <p>Input only ever grows: {@link #withField} refuses to replace a value that is already
 * set, and replacing one requires the explicit {@link #replaceField}. A field can also be
 * recorded as <em>skipped</em>, meaning the user declared it unknown; a skipped field
 * counts as absent for completeness and as settled for the conversation.</p>
 */
public final class UserInput implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final UserInput EMPTY = new UserInput(Map.of(), Set.of());

    private final Map<String, Object> values;
    private final Set<String> skipped;

    private UserInput(Map<String, Object> values, Set<String> skipped) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.skipped = Collections.unmodifiableSet(new LinkedHashSet<>(skipped));
    }

    public static UserInput empty() {
        return EMPTY;
    }

    public static UserInput of(Map<String, Object> values) {
        values.forEach((field, value) -> requireValue(field, value));
        return new UserInput(values, Set.of());
    }

    /**
     * True when the field holds a value. Skipped fields are never present.
     */
    public boolean has(String field) {
        return values.containsKey(field);
    }

    public boolean isSkipped(String field) {
        return skipped.contains(field);
    }

    /**
     * A field is settled once it has a value or was skipped.
     */
    public boolean isSettled(String field) {
        return has(field) || isSkipped(field);
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public Optional<String> getString(String field) {
        return get(field).map(Object::toString);
    }

    public Optional<Integer> getInt(String field) {
        return get(field).map(v -> v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString()));
    }

    @SuppressWarnings("unchecked")
    public List<Integer> getNumbers() {
        Object raw = values.get(FieldNames.NUMBERS);
        if (raw instanceof List<?> list) {
            return (List<Integer>) list;
        }
        return List.of();
    }

    public Set<String> fields() {
        return values.keySet();
    }

    public Set<String> skippedFields() {
        return skipped;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Adds a new field.
     *
     * @throws IllegalStateException if the field already holds a value
     */
    public UserInput withField(String field, Object value) {
        requireValue(field, value);
        if (values.containsKey(field)) {
            throw new IllegalStateException("Field '" + field + "' is already set; use replaceField to change it");
        }
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(field, value);
        Set<String> nextSkipped = new LinkedHashSet<>(skipped);
        nextSkipped.remove(field);
        return new UserInput(next, nextSkipped);
    }

    /**
     * Explicit modification: sets the field whether or not it was set before.
     */
    public UserInput replaceField(String field, Object value) {
        requireValue(field, value);
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(field, value);
        Set<String> nextSkipped = new LinkedHashSet<>(skipped);
        nextSkipped.remove(field);
        return new UserInput(next, nextSkipped);
    }

    /**
     * Records a field as permanently absent. A value already present is kept.
     */
    public UserInput withSkipped(String field) {
        if (values.containsKey(field) || skipped.contains(field)) {
            return this;
        }
        Set<String> nextSkipped = new LinkedHashSet<>(skipped);
        nextSkipped.add(field);
        return new UserInput(values, nextSkipped);
    }

    private static void requireValue(String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("Field '" + field + "' must not be set to null");
        }
    }

    @Override
    public String toString() {
        return "UserInput" + values.keySet() + (skipped.isEmpty() ? "" : " skipped=" + skipped);
    }
}
