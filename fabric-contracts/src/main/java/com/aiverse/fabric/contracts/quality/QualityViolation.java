package com.aiverse.fabric.contracts.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QualityViolation(
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("expected") double expected,
        @JsonProperty("actual") double actual) {
}
