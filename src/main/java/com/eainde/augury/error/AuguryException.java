package com.eainde.augury.error;

/**
 * Root of the engine's unchecked exception hierarchy.
 */
public class AuguryException extends RuntimeException {

    public AuguryException(String message) {
        super(message);
    }

    public AuguryException(String message, Throwable cause) {
        super(message, cause);
    }
}
