package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Replication consistency. */
public enum ConsistencyMode {
    @JsonProperty("eventual") EVENTUAL("eventual"),
    @JsonProperty("strong") STRONG("strong");

    private final String value;

    ConsistencyMode(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
