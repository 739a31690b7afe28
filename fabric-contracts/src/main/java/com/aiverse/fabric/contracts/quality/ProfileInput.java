package com.aiverse.fabric.contracts.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record ProfileInput(
        @JsonProperty("dataset_ref") String datasetRef,
        @JsonProperty("sample_size") int sampleSize,
        @JsonProperty("profiling_depth") String profilingDepth) {

    public ProfileInput {
        Objects.requireNonNull(datasetRef, "dataset_ref");
    }
}
