package com.aiverse.fabric.contracts.schema;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record SchemaValidationResult(
        @JsonProperty("is_valid") boolean isValid,
        @JsonProperty("discrepancies") List<SchemaDiscrepancy> discrepancies,
        @JsonProperty("validated_at") Instant validatedAt) {

    public SchemaValidationResult {
        discrepancies = Copies.list(discrepancies);
    }
}
