package com.aiverse.fabric.contracts.schema;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Discovered schema of an external source, with sample values per field. */
public record SchemaIntrospectionResult(
        @JsonProperty("fields") List<FieldDefinition> fields,
        @JsonProperty("primary_keys") List<String> primaryKeys,
        @JsonProperty("row_count_estimate") long rowCountEstimate,
        @JsonProperty("sample_values") Map<String, List<Object>> sampleValues,
        @JsonProperty("introspected_at") Instant introspectedAt) {

    public SchemaIntrospectionResult {
        fields = Copies.list(fields);
        primaryKeys = Copies.list(primaryKeys);
        sampleValues = Copies.map(sampleValues);
    }
}
