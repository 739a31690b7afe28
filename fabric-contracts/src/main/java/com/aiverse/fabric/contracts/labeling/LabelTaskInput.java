package com.aiverse.fabric.contracts.labeling;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

public record LabelTaskInput(
        @JsonProperty("source_dataset_ref") String sourceDatasetRef,
        @JsonProperty("sample_criteria") Map<String, Object> sampleCriteria,
        @JsonProperty("label_schema_ref") String labelSchemaRef,
        @JsonProperty("quality_requirements") Map<String, Double> qualityRequirements) {

    public LabelTaskInput {
        Objects.requireNonNull(sourceDatasetRef, "source_dataset_ref");
        Objects.requireNonNull(labelSchemaRef, "label_schema_ref");
        sampleCriteria = Copies.map(sampleCriteria);
        qualityRequirements = Copies.map(qualityRequirements);
    }
}
