package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Where data sits relative to an execution environment. */
public enum LocalityType {
    @JsonProperty("local") LOCAL("local"),
    @JsonProperty("cached") CACHED("cached"),
    @JsonProperty("remote") REMOTE("remote"),
    @JsonProperty("unavailable") UNAVAILABLE("unavailable");

    private final String value;

    LocalityType(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }

    /**
     * Resolves a wire value reported by a locality prober.
     *
     * @throws IllegalArgumentException if the value is not a known locality type
     */
    public static LocalityType fromValue(String value) {
        for (LocalityType t : values()) {
            if (t.value.equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown locality type: " + value);
    }
}
