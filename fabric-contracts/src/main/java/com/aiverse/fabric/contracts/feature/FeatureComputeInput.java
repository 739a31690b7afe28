package com.aiverse.fabric.contracts.feature;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record FeatureComputeInput(
        @JsonProperty("source_data_ref") String sourceDataRef,
        @JsonProperty("feature_definition_ref") String featureDefinitionRef,
        @JsonProperty("entity_key_columns") List<String> entityKeyColumns,
        @JsonProperty("time_start") Instant timeStart,
        @JsonProperty("time_end") Instant timeEnd,
        @JsonProperty("output_staging_ref") String outputStagingRef) {

    public FeatureComputeInput {
        Objects.requireNonNull(sourceDataRef, "source_data_ref");
        Objects.requireNonNull(featureDefinitionRef, "feature_definition_ref");
        Objects.requireNonNull(timeStart, "time_start");
        Objects.requireNonNull(timeEnd, "time_end");
        Objects.requireNonNull(outputStagingRef, "output_staging_ref");
        entityKeyColumns = Copies.list(entityKeyColumns);
    }
}
