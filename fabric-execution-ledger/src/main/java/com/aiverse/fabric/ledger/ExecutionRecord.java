package com.aiverse.fabric.ledger;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ledger view of one intent execution and the units it ran, in run order.
 */
public record ExecutionRecord(
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("intent_id") String intentId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("intent_type") String intentType,
        @JsonProperty("domain") String domain,
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("inputs") Map<String, Object> inputs,
        @JsonProperty("status") ExecutionStatus status,
        @JsonProperty("submitted_at") Instant submittedAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("ended_at") Instant endedAt,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("units") List<UnitRecord> units) {

    public ExecutionRecord {
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(status, "status");
        inputs = Copies.map(inputs);
        units = Copies.list(units);
    }

    /** New record in SUBMITTED state. */
    public static ExecutionRecord submitted(String executionId, String intentId, String tenantId, String intentType,
                                            String domain, String traceId, Map<String, Object> inputs, Instant at) {
        return new ExecutionRecord(executionId, intentId, tenantId, intentType, domain, traceId, inputs,
                ExecutionStatus.SUBMITTED, at, null, null, null, List.of());
    }

    ExecutionRecord withStatus(ExecutionStatus next, Instant at, String error) {
        Instant started = next == ExecutionStatus.RUNNING && startedAt == null ? at : startedAt;
        Instant ended = next.isTerminal() ? at : endedAt;
        return new ExecutionRecord(executionId, intentId, tenantId, intentType, domain, traceId, inputs, next,
                submittedAt, started, ended, error != null ? error : errorMessage, units);
    }

    ExecutionRecord withUnits(List<UnitRecord> unitRecords) {
        return new ExecutionRecord(executionId, intentId, tenantId, intentType, domain, traceId, inputs, status,
                submittedAt, startedAt, endedAt, errorMessage, unitRecords);
    }
}
