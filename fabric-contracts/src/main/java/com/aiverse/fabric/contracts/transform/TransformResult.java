package com.aiverse.fabric.contracts.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Row counts and a short fingerprint of the applied transformation. */
public record TransformResult(
        @JsonProperty("rows_processed") long rowsProcessed,
        @JsonProperty("rows_output") long rowsOutput,
        @JsonProperty("output_staging_ref") String outputStagingRef,
        @JsonProperty("transformation_hash") String transformationHash,
        @JsonProperty("transformed_at") Instant transformedAt) {
}
