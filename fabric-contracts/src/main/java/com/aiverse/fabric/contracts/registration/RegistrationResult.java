package com.aiverse.fabric.contracts.registration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/** Outcome of a successful asset registration. */
public record RegistrationResult(
        @JsonProperty("asset_id") UUID assetId,
        @JsonProperty("card_ref") String cardRef,
        @JsonProperty("registered_at") Instant registeredAt) {
}
