package com.aiverse.fabric.contracts.feature;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record FeatureValue(
        @JsonProperty("entity_key") Map<String, Object> entityKey,
        @JsonProperty("feature_name") String featureName,
        @JsonProperty("value") Object value,
        @JsonProperty("is_missing") boolean isMissing,
        @JsonProperty("staleness_seconds") long stalenessSeconds) {

    public FeatureValue {
        entityKey = Copies.map(entityKey);
    }
}
