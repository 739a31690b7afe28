package com.aiverse.fabric.contracts.transform;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

public record TransformInput(
        @JsonProperty("input_data_ref") String inputDataRef,
        @JsonProperty("transformation_definition") Map<String, Object> transformationDefinition,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("output_staging_ref") String outputStagingRef) {

    public TransformInput {
        Objects.requireNonNull(inputDataRef, "input_data_ref");
        Objects.requireNonNull(outputStagingRef, "output_staging_ref");
        transformationDefinition = Copies.map(transformationDefinition);
        parameters = Copies.map(parameters);
    }
}
