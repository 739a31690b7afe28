package com.aiverse.fabric.contracts.schema;

import com.aiverse.fabric.contracts.ValidationMode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record SchemaValidationInput(
        @JsonProperty("dataset_ref") String datasetRef,
        @JsonProperty("expected_schema_ref") String expectedSchemaRef,
        @JsonProperty("validation_mode") ValidationMode validationMode) {

    public SchemaValidationInput {
        Objects.requireNonNull(datasetRef, "dataset_ref");
        Objects.requireNonNull(expectedSchemaRef, "expected_schema_ref");
        Objects.requireNonNull(validationMode, "validation_mode");
    }
}
