package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Kind of asset a registry card describes. */
public enum AssetType {
    @JsonProperty("dataset") DATASET("dataset"),
    @JsonProperty("feature_set") FEATURE_SET("feature_set"),
    @JsonProperty("label_set") LABEL_SET("label_set");

    private final String value;

    AssetType(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
