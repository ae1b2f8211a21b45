package com.eainde.augury.error;

public class ExtractionProviderException extends ExtractionException {

    public ExtractionProviderException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
