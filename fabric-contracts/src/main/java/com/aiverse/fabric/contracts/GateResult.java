package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of a quality gate. */
public enum GateResult {
    @JsonProperty("pass") PASS("pass"),
    @JsonProperty("fail") FAIL("fail"),
    @JsonProperty("inconclusive") INCONCLUSIVE("inconclusive");

    private final String value;

    GateResult(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
