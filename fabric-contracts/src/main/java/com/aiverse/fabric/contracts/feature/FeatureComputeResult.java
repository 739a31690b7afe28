package com.aiverse.fabric.contracts.feature;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FeatureComputeResult(
        @JsonProperty("entities_computed") long entitiesComputed,
        @JsonProperty("feature_values_count") long featureValuesCount,
        @JsonProperty("output_staging_ref") String outputStagingRef,
        @JsonProperty("computed_at") Instant computedAt) {
}
