package com.aiverse.fabric.contracts.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record SchemaIntrospectionInput(
        @JsonProperty("connection_ref") String connectionRef,
        @JsonProperty("source_path") String sourcePath,
        @JsonProperty("sample_size") int sampleSize) {

    public SchemaIntrospectionInput {
        Objects.requireNonNull(connectionRef, "connection_ref");
        Objects.requireNonNull(sourcePath, "source_path");
    }
}
