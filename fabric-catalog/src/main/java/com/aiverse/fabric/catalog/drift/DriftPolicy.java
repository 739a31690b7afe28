package com.aiverse.fabric.catalog.drift;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Detection and response settings for one drift type, scoped by namespace prefixes and required tag values.
 * Thresholds are ratios whose meaning depends on the drift type (multiples of the refresh interval for
 * freshness, relative change for quality).
 */
public final class DriftPolicy {

    private final String policyId;
    private final String name;
    private final DriftType driftType;
    private final boolean detectionEnabled;
    private final DetectionFrequency detectionFrequency;
    private final Double warningThreshold;
    private final Double errorThreshold;
    private final boolean autoRemediate;
    private final boolean notifyOwners;
    private final boolean blockDownstream;
    private final boolean requireApproval;
    private final List<String> applyToNamespaces;
    private final Map<String, String> applyToTags;

    private DriftPolicy(Builder b) {
        this.policyId = b.policyId != null ? b.policyId : UUID.randomUUID().toString();
        this.name = Objects.requireNonNull(b.name, "name");
        this.driftType = Objects.requireNonNull(b.driftType, "driftType");
        this.detectionEnabled = b.detectionEnabled;
        this.detectionFrequency = b.detectionFrequency;
        this.warningThreshold = b.warningThreshold;
        this.errorThreshold = b.errorThreshold;
        this.autoRemediate = b.autoRemediate;
        this.notifyOwners = b.notifyOwners;
        this.blockDownstream = b.blockDownstream;
        this.requireApproval = b.requireApproval;
        this.applyToNamespaces = List.copyOf(b.applyToNamespaces);
        this.applyToTags = Map.copyOf(b.applyToTags);
    }

    public static Builder builder(String name, DriftType driftType) {
        return new Builder(name, driftType);
    }

    /**
     * True if the namespace starts with one of the configured prefixes (none configured means all) and every
     * configured tag has the same value in {@code tags}.
     */
    public boolean shouldApply(String namespace, Map<String, String> tags) {
        if (!applyToNamespaces.isEmpty()) {
            String ns = namespace != null ? namespace : "";
            if (applyToNamespaces.stream().noneMatch(ns::startsWith)) {
                return false;
            }
        }
        Map<String, String> actual = tags != null ? tags : Map.of();
        for (Map.Entry<String, String> e : applyToTags.entrySet()) {
            if (!e.getValue().equals(actual.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public String getPolicyId() { return policyId; }
    public String getName() { return name; }
    public DriftType getDriftType() { return driftType; }
    public boolean isDetectionEnabled() { return detectionEnabled; }
    public DetectionFrequency getDetectionFrequency() { return detectionFrequency; }
    public Double getWarningThreshold() { return warningThreshold; }
    public Double getErrorThreshold() { return errorThreshold; }
    public boolean isAutoRemediate() { return autoRemediate; }
    public boolean isNotifyOwners() { return notifyOwners; }
    public boolean isBlockDownstream() { return blockDownstream; }
    public boolean isRequireApproval() { return requireApproval; }
    public List<String> getApplyToNamespaces() { return applyToNamespaces; }
    public Map<String, String> getApplyToTags() { return applyToTags; }

    public static final class Builder {
        private String policyId;
        private final String name;
        private final DriftType driftType;
        private boolean detectionEnabled = true;
        private DetectionFrequency detectionFrequency = DetectionFrequency.HOURLY;
        private Double warningThreshold;
        private Double errorThreshold;
        private boolean autoRemediate;
        private boolean notifyOwners = true;
        private boolean blockDownstream;
        private boolean requireApproval;
        private List<String> applyToNamespaces = List.of();
        private Map<String, String> applyToTags = Map.of();

        private Builder(String name, DriftType driftType) {
            this.name = name;
            this.driftType = driftType;
        }

        public Builder policyId(String policyId) { this.policyId = policyId; return this; }
        public Builder detectionEnabled(boolean v) { this.detectionEnabled = v; return this; }
        public Builder detectionFrequency(DetectionFrequency v) { this.detectionFrequency = v; return this; }
        public Builder warningThreshold(Double v) { this.warningThreshold = v; return this; }
        public Builder errorThreshold(Double v) { this.errorThreshold = v; return this; }
        public Builder autoRemediate(boolean v) { this.autoRemediate = v; return this; }
        public Builder notifyOwners(boolean v) { this.notifyOwners = v; return this; }
        public Builder blockDownstream(boolean v) { this.blockDownstream = v; return this; }
        public Builder requireApproval(boolean v) { this.requireApproval = v; return this; }
        public Builder applyToNamespaces(List<String> v) { this.applyToNamespaces = v != null ? v : List.of(); return this; }
        public Builder applyToTags(Map<String, String> v) { this.applyToTags = v != null ? v : Map.of(); return this; }

        public DriftPolicy build() {
            return new DriftPolicy(this);
        }
    }
}
