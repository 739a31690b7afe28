package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How a dataset write treats existing data. */
public enum WriteMode {
    @JsonProperty("append") APPEND("append"),
    @JsonProperty("overwrite") OVERWRITE("overwrite");

    private final String value;

    WriteMode(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
