package com.aiverse.fabric.contracts.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A single difference between the expected and the actual schema. */
public record SchemaDiscrepancy(
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("expected_type") String expectedType,
        @JsonProperty("actual_type") String actualType,
        @JsonProperty("issue") String issue) {
}
