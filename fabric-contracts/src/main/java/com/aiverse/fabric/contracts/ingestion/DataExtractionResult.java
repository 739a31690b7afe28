package com.aiverse.fabric.contracts.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DataExtractionResult(
        @JsonProperty("bytes_extracted") long bytesExtracted,
        @JsonProperty("rows_extracted") long rowsExtracted,
        @JsonProperty("staging_ref") String stagingRef,
        @JsonProperty("watermark_value") String watermarkValue,
        @JsonProperty("extracted_at") Instant extractedAt) {
}
