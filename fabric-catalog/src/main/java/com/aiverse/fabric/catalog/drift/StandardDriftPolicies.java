package com.aiverse.fabric.catalog.drift;

import com.aiverse.fabric.catalog.tags.StandardTags;

import java.util.List;
import java.util.Map;

/** Standard drift policies: strict schema control in production, relaxed in development, SLAs for gold data. */
public final class StandardDriftPolicies {

    private StandardDriftPolicies() {
    }

    public static List<DriftPolicy> policies() {
        return List.of(
                DriftPolicy.builder("schema_drift_production", DriftType.SCHEMA)
                        .detectionFrequency(DetectionFrequency.REALTIME)
                        .notifyOwners(true)
                        .blockDownstream(true)
                        .requireApproval(true)
                        .applyToTags(Map.of(StandardTags.ENVIRONMENT, "production"))
                        .build(),
                DriftPolicy.builder("schema_drift_development", DriftType.SCHEMA)
                        .detectionFrequency(DetectionFrequency.DAILY)
                        .notifyOwners(false)
                        .applyToTags(Map.of(StandardTags.ENVIRONMENT, "development"))
                        .build(),
                DriftPolicy.builder("freshness_sla", DriftType.FRESHNESS)
                        .detectionFrequency(DetectionFrequency.HOURLY)
                        .warningThreshold(1.5)
                        .errorThreshold(2.0)
                        .applyToTags(Map.of(StandardTags.DATA_QUALITY, "gold"))
                        .build(),
                DriftPolicy.builder("quality_monitoring", DriftType.QUALITY)
                        .detectionFrequency(DetectionFrequency.DAILY)
                        .warningThreshold(0.05)
                        .errorThreshold(0.10)
                        .applyToTags(Map.of(StandardTags.DATA_QUALITY, "gold"))
                        .build());
    }
}
