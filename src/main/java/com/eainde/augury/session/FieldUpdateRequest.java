package com.eainde.augury.session;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FieldUpdateRequest(@JsonProperty("value") Object value) {
}
