package com.eainde.augury.theory.runner;

import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.UserInput;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

final class RunnerSupport {

    private RunnerSupport() {}

    static Optional<LocalDateTime> inquiryTime(UserInput input) {
        Optional<Object> raw = input.get(FieldNames.INQUIRY_TIME);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Object value = raw.get();
        if (value instanceof LocalDateTime time) {
            return Optional.of(time);
        }
        try {
            return Optional.of(LocalDateTime.parse(value.toString()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
