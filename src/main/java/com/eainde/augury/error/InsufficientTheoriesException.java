package com.eainde.augury.error;

import java.util.List;

/**
 * No theory could produce a result for the current input.
 * Carries the fields that would make at least one theory eligible.
 */
public class InsufficientTheoriesException extends AuguryException {

    private final List<String> missingFields;

    public InsufficientTheoriesException(List<String> missingFields) {
        super("No theory could be run; missing fields: " + missingFields);
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
