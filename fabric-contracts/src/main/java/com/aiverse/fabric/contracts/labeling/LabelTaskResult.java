package com.aiverse.fabric.contracts.labeling;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record LabelTaskResult(
        @JsonProperty("task_id") UUID taskId,
        @JsonProperty("sample_count") int sampleCount,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt) {
}
