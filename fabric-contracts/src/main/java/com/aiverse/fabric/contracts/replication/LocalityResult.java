package com.aiverse.fabric.contracts.replication;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record LocalityResult(
        @JsonProperty("signals") List<LocalitySignal> signals,
        @JsonProperty("signal_freshness") Instant signalFreshness) {

    public LocalityResult {
        signals = Copies.list(signals);
    }
}
