package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Sensitivity classification of a data asset. */
public enum DataClassification {
    @JsonProperty("public") PUBLIC("public"),
    @JsonProperty("internal") INTERNAL("internal"),
    @JsonProperty("confidential") CONFIDENTIAL("confidential"),
    @JsonProperty("restricted") RESTRICTED("restricted"),
    @JsonProperty("pii") PII("pii");

    private final String value;

    DataClassification(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
