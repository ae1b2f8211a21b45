package com.eainde.augury.error;

import java.time.Duration;

public class ExtractionTimeoutException extends ExtractionException {

    public ExtractionTimeoutException(String stage, Duration timeout) {
        super(stage, "Extraction did not answer within " + timeout.toMillis() + "ms");
    }
}
