package com.eainde.augury.error;

/**
 * No unused, eligible arbitrator could be run for a severe conflict.
 * Never shown to the user; the resolver falls back to a conservative blend.
 */
public class ArbitrationUnavailableException extends AuguryException {

    private final String category;

    public ArbitrationUnavailableException(String category, String message) {
        super(message);
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
