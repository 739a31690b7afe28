package com.aiverse.fabric.contracts.feature;

import com.aiverse.fabric.contracts.StoreType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record FeatureStoreWriteInput(
        @JsonProperty("staging_ref") String stagingRef,
        @JsonProperty("feature_set_ref") String featureSetRef,
        @JsonProperty("store_type") StoreType storeType,
        @JsonProperty("ttl_seconds") long ttlSeconds) {

    public FeatureStoreWriteInput {
        Objects.requireNonNull(stagingRef, "staging_ref");
        Objects.requireNonNull(featureSetRef, "feature_set_ref");
        Objects.requireNonNull(storeType, "store_type");
    }
}
