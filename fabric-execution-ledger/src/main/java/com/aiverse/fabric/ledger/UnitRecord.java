package com.aiverse.fabric.ledger;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One execution unit run within an intent execution.
 *
 * @param output map form of the unit output; empty when the unit threw
 */
public record UnitRecord(
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("unit_id") String unitId,
        @JsonProperty("capability_type") String capabilityType,
        @JsonProperty("input") Map<String, Object> input,
        @JsonProperty("output") Map<String, Object> output,
        @JsonProperty("succeeded") boolean succeeded,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("recorded_at") Instant recordedAt,
        @JsonProperty("duration_ms") long durationMs) {

    public UnitRecord {
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(unitId, "unitId");
        input = Copies.map(input);
        output = Copies.map(output);
    }
}
