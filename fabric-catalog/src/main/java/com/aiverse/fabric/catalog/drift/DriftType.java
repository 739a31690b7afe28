package com.aiverse.fabric.catalog.drift;

public enum DriftType {
    /** Column additions, removals, type changes. */
    SCHEMA,
    /** Distribution changes. */
    DATA,
    /** Tag, ownership or classification changes. */
    METADATA,
    LINEAGE,
    /** Staleness against the expected refresh interval. */
    FRESHNESS,
    /** Degradation of quality metrics. */
    QUALITY
}
