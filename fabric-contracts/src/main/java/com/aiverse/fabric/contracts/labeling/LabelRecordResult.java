package com.aiverse.fabric.contracts.labeling;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record LabelRecordResult(
        @JsonProperty("annotation_id") UUID annotationId,
        @JsonProperty("recorded_at") Instant recordedAt) {
}
