package com.aiverse.fabric.contracts.versioning;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MergeConflict(
        @JsonProperty("path") String path,
        @JsonProperty("source_value") Object sourceValue,
        @JsonProperty("target_value") Object targetValue) {
}
