package com.aiverse.fabric.contracts.replication;

import com.aiverse.fabric.contracts.LocalityType;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Placement hint for one execution environment. A negative transfer cost means unknown. */
public record LocalitySignal(
        @JsonProperty("environment_id") String environmentId,
        @JsonProperty("locality_type") LocalityType localityType,
        @JsonProperty("transfer_cost_estimate") double transferCostEstimate,
        @JsonProperty("confidence") double confidence) {
}
