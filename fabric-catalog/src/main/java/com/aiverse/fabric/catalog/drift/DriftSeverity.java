package com.aiverse.fabric.catalog.drift;

/** Ordered from least to most severe. ERROR may block downstream; CRITICAL blocks. */
public enum DriftSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
