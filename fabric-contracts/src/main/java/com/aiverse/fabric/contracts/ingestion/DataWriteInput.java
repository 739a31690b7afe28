package com.aiverse.fabric.contracts.ingestion;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.WriteMode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/** Persist staged data into a dataset. {@code partitionSpec} may be null. */
public record DataWriteInput(
        @JsonProperty("staging_ref") String stagingRef,
        @JsonProperty("target_dataset_ref") String targetDatasetRef,
        @JsonProperty("write_mode") WriteMode writeMode,
        @JsonProperty("partition_spec") Map<String, Object> partitionSpec) {

    public DataWriteInput {
        Objects.requireNonNull(stagingRef, "staging_ref");
        Objects.requireNonNull(targetDatasetRef, "target_dataset_ref");
        Objects.requireNonNull(writeMode, "write_mode");
        partitionSpec = partitionSpec != null ? Copies.map(partitionSpec) : null;
    }
}
