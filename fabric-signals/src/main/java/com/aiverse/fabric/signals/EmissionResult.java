package com.aiverse.fabric.signals;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one emission attempt. {@code error} is set when {@code success} is false.
 */
public record EmissionResult(
        String signalName,
        SignalType signalType,
        boolean success,
        UUID emissionId,
        Instant timestamp,
        String error) {

    static EmissionResult failed(String name, SignalType type, UUID id, Instant at, String error) {
        return new EmissionResult(name, type, false, id, at, error);
    }
}
