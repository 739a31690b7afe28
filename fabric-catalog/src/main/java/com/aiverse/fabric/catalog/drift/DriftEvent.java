package com.aiverse.fabric.catalog.drift;

import com.aiverse.fabric.contracts.Copies;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/** A detected drift on one asset, with the states compared. */
public record DriftEvent(
        String eventId,
        DriftType driftType,
        DriftSeverity severity,
        String assetId,
        String assetName,
        String namespace,
        Map<String, Object> previousState,
        Map<String, Object> currentState,
        String description,
        Instant detectedAt,
        DriftEventStatus status,
        String resolvedBy,
        Instant resolvedAt) {

    public DriftEvent {
        eventId = eventId != null ? eventId : UUID.randomUUID().toString();
        Objects.requireNonNull(driftType, "driftType");
        Objects.requireNonNull(severity, "severity");
        assetName = assetName != null ? assetName : "";
        namespace = namespace != null ? namespace : "";
        previousState = Copies.map(previousState);
        currentState = Copies.map(currentState);
        status = status != null ? status : DriftEventStatus.OPEN;
    }

    static DriftEvent open(DriftType type, DriftSeverity severity, String assetId, Map<String, Object> previous,
                           Map<String, Object> current, String description, Instant at) {
        return new DriftEvent(null, type, severity, assetId, null, null, previous, current, description, at,
                DriftEventStatus.OPEN, null, null);
    }

    public boolean isOpen() {
        return status == DriftEventStatus.OPEN;
    }

    DriftEvent resolved(String by, Instant at) {
        return new DriftEvent(eventId, driftType, severity, assetId, assetName, namespace, previousState, currentState,
                description, detectedAt, DriftEventStatus.RESOLVED, by, at);
    }
}
