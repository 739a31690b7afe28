package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Join semantics. */
public enum JoinType {
    @JsonProperty("inner") INNER("inner"),
    @JsonProperty("left") LEFT("left"),
    @JsonProperty("right") RIGHT("right"),
    @JsonProperty("full") FULL("full");

    private final String value;

    JoinType(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
