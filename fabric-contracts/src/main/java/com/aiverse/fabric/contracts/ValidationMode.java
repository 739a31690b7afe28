package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Strictness of schema validation. */
public enum ValidationMode {
    @JsonProperty("exact") EXACT("exact"),
    @JsonProperty("compatible") COMPATIBLE("compatible"),
    @JsonProperty("subset") SUBSET("subset");

    private final String value;

    ValidationMode(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
