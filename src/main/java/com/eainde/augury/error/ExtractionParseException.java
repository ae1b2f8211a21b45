package com.eainde.augury.error;

public class ExtractionParseException extends ExtractionException {

    public ExtractionParseException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
