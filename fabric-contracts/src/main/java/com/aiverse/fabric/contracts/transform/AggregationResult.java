package com.aiverse.fabric.contracts.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AggregationResult(
        @JsonProperty("groups_computed") long groupsComputed,
        @JsonProperty("output_staging_ref") String outputStagingRef,
        @JsonProperty("aggregated_at") Instant aggregatedAt) {
}
