package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of a merge computation. */
public enum MergeResult {
    @JsonProperty("success") SUCCESS("success"),
    @JsonProperty("conflict") CONFLICT("conflict");

    private final String value;

    MergeResult(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
