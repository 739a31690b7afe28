package com.aiverse.fabric.contracts.feature;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.StoreType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Point lookup of feature values. A null {@code pointInTime} means latest. */
public record FeatureRetrieveInput(
        @JsonProperty("feature_set_ref") String featureSetRef,
        @JsonProperty("entity_keys") List<Map<String, Object>> entityKeys,
        @JsonProperty("feature_names") List<String> featureNames,
        @JsonProperty("point_in_time") Instant pointInTime,
        @JsonProperty("store_preference") StoreType storePreference) {

    public FeatureRetrieveInput {
        Objects.requireNonNull(featureSetRef, "feature_set_ref");
        Objects.requireNonNull(storePreference, "store_preference");
        entityKeys = Copies.list(entityKeys);
        featureNames = Copies.list(featureNames);
    }
}
