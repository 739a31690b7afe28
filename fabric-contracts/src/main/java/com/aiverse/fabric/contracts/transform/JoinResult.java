package com.aiverse.fabric.contracts.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record JoinResult(
        @JsonProperty("rows_output") long rowsOutput,
        @JsonProperty("matched_count") long matchedCount,
        @JsonProperty("unmatched_left") long unmatchedLeft,
        @JsonProperty("unmatched_right") long unmatchedRight,
        @JsonProperty("output_staging_ref") String outputStagingRef,
        @JsonProperty("joined_at") Instant joinedAt) {
}
