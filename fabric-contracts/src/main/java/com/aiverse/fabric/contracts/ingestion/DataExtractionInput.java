package com.aiverse.fabric.contracts.ingestion;

import com.aiverse.fabric.contracts.DataFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Bounded extraction from an external source into a staging area. */
public record DataExtractionInput(
        @JsonProperty("source_connection_ref") String sourceConnectionRef,
        @JsonProperty("source_query_or_path") String sourceQueryOrPath,
        @JsonProperty("extraction_offset") long extractionOffset,
        @JsonProperty("extraction_limit") long extractionLimit,
        @JsonProperty("output_format") DataFormat outputFormat,
        @JsonProperty("target_staging_ref") String targetStagingRef) {

    public DataExtractionInput {
        Objects.requireNonNull(sourceConnectionRef, "source_connection_ref");
        Objects.requireNonNull(sourceQueryOrPath, "source_query_or_path");
        Objects.requireNonNull(outputFormat, "output_format");
        Objects.requireNonNull(targetStagingRef, "target_staging_ref");
    }
}
