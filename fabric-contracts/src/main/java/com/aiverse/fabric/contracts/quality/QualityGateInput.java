package com.aiverse.fabric.contracts.quality;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

public record QualityGateInput(
        @JsonProperty("dataset_ref") String datasetRef,
        @JsonProperty("quality_rules_ref") String qualityRulesRef,
        @JsonProperty("thresholds") Map<String, Double> thresholds) {

    public QualityGateInput {
        Objects.requireNonNull(datasetRef, "dataset_ref");
        Objects.requireNonNull(qualityRulesRef, "quality_rules_ref");
        thresholds = Copies.map(thresholds);
    }
}
