package com.aiverse.fabric.contracts.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record ConnectionProbeInput(
        @JsonProperty("connection_ref") String connectionRef,
        @JsonProperty("credential_ref") String credentialRef,
        @JsonProperty("timeout_seconds") int timeoutSeconds) {

    public ConnectionProbeInput {
        Objects.requireNonNull(connectionRef, "connection_ref");
        Objects.requireNonNull(credentialRef, "credential_ref");
    }
}
