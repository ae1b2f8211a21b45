package com.eainde.augury.analysis;

import java.time.Duration;

/**
 * @param poolSize   worker threads shared by all theory runs
 * @param runTimeout upper bound for one theory run; a slower run is dropped like a failed one
 */
public record ExecutionSettings(int poolSize, Duration runTimeout) {

    public ExecutionSettings {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be positive, was " + poolSize);
        }
        if (runTimeout == null || runTimeout.isNegative() || runTimeout.isZero()) {
            throw new IllegalArgumentException("runTimeout must be positive");
        }
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(8, Duration.ofSeconds(10));
    }
}
