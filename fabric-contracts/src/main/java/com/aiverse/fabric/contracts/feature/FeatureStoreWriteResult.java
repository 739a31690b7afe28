package com.aiverse.fabric.contracts.feature;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FeatureStoreWriteResult(
        @JsonProperty("entities_written") long entitiesWritten,
        @JsonProperty("store_location") String storeLocation,
        @JsonProperty("written_at") Instant writtenAt) {
}
