package com.aiverse.fabric.contracts.lineage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record LineageEdgeInput(
        @JsonProperty("source_asset_ref") String sourceAssetRef,
        @JsonProperty("target_asset_ref") String targetAssetRef,
        @JsonProperty("relationship_type") String relationshipType,
        @JsonProperty("execution_ref") String executionRef) {

    public LineageEdgeInput {
        Objects.requireNonNull(sourceAssetRef, "source_asset_ref");
        Objects.requireNonNull(targetAssetRef, "target_asset_ref");
    }
}
