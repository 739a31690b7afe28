package com.aiverse.fabric.contracts.lineage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record LineageEdgeResult(
        @JsonProperty("edge_id") UUID edgeId,
        @JsonProperty("created_at") Instant createdAt) {
}
