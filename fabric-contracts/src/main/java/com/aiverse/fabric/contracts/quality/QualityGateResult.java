package com.aiverse.fabric.contracts.quality;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.GateResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record QualityGateResult(
        @JsonProperty("result") GateResult result,
        @JsonProperty("metric_values") Map<String, Double> metricValues,
        @JsonProperty("violations") List<QualityViolation> violations,
        @JsonProperty("evaluated_at") Instant evaluatedAt) {

    public QualityGateResult {
        metricValues = Copies.map(metricValues);
        violations = Copies.list(violations);
    }
}
