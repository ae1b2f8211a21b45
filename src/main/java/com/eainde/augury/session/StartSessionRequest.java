package com.eainde.augury.session;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StartSessionRequest(@JsonProperty("question") String question) {
}
