package com.aiverse.fabric.catalog.drift;

public enum DriftEventStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED,
    IGNORED
}
