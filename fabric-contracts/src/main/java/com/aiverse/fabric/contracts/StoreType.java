package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Feature store tier. */
public enum StoreType {
    @JsonProperty("offline") OFFLINE("offline"),
    @JsonProperty("online") ONLINE("online");

    private final String value;

    StoreType(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
