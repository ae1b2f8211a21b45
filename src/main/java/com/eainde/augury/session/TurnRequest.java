package com.eainde.augury.session;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TurnRequest(@JsonProperty("text") String text) {
}
