package com.aiverse.fabric.contracts.replication;

import com.aiverse.fabric.contracts.ConsistencyMode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record ReplicationInput(
        @JsonProperty("source_location_ref") String sourceLocationRef,
        @JsonProperty("target_location_ref") String targetLocationRef,
        @JsonProperty("consistency_mode") ConsistencyMode consistencyMode) {

    public ReplicationInput {
        Objects.requireNonNull(sourceLocationRef, "source_location_ref");
        Objects.requireNonNull(targetLocationRef, "target_location_ref");
        Objects.requireNonNull(consistencyMode, "consistency_mode");
    }
}
