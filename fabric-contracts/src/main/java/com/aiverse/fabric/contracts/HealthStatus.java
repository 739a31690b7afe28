package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Connection probe verdict. */
public enum HealthStatus {
    @JsonProperty("healthy") HEALTHY("healthy"),
    @JsonProperty("degraded") DEGRADED("degraded"),
    @JsonProperty("unhealthy") UNHEALTHY("unhealthy");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
