package com.aiverse.fabric.contracts.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FieldDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("nullable") boolean nullable,
        @JsonProperty("is_key") boolean isKey) {
}
