package com.aiverse.fabric.contracts.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DataWriteResult(
        @JsonProperty("bytes_written") long bytesWritten,
        @JsonProperty("rows_written") long rowsWritten,
        @JsonProperty("target_location") String targetLocation,
        @JsonProperty("written_at") Instant writtenAt) {
}
