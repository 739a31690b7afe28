package com.aiverse.fabric.contracts.connection;

import com.aiverse.fabric.contracts.HealthStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Health verdict for a probed connection. {@code errorDetails} is null when healthy. */
public record ConnectionProbeResult(
        @JsonProperty("health_status") HealthStatus healthStatus,
        @JsonProperty("latency_ms") long latencyMs,
        @JsonProperty("error_details") String errorDetails,
        @JsonProperty("probed_at") Instant probedAt) {
}
