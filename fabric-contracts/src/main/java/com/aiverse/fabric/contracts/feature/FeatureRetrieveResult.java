package com.aiverse.fabric.contracts.feature;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record FeatureRetrieveResult(
        @JsonProperty("values") List<FeatureValue> values,
        @JsonProperty("retrieved_at") Instant retrievedAt) {

    public FeatureRetrieveResult {
        values = Copies.list(values);
    }
}
