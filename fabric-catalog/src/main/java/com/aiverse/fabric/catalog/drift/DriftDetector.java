package com.aiverse.fabric.catalog.drift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Detects schema, freshness and quality drift on catalog assets and keeps the recorded events.
 * Detection methods only build events; {@link #recordEvent} stores them.
 */
public final class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    public static final int DEFAULT_EXPECTED_FREQUENCY_HOURS = 24;
    public static final double DEFAULT_QUALITY_THRESHOLD = 0.1;

    private final Clock clock;
    private final Map<String, DriftPolicy> policies = new LinkedHashMap<>();
    private final List<DriftEvent> events = new CopyOnWriteArrayList<>();

    public DriftDetector() {
        this(Clock.systemUTC());
    }

    public DriftDetector(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Detector with {@link StandardDriftPolicies#policies()} registered. */
    public static DriftDetector standard(Clock clock) {
        DriftDetector detector = new DriftDetector(clock);
        StandardDriftPolicies.policies().forEach(detector::registerPolicy);
        return detector;
    }

    public synchronized void registerPolicy(DriftPolicy policy) {
        policies.put(policy.getPolicyId(), policy);
    }

    public synchronized List<DriftPolicy> getPolicies() {
        return List.copyOf(policies.values());
    }

    /** Enabled policies of the given type that apply to the asset's namespace and tags. */
    public synchronized List<DriftPolicy> applicablePolicies(DriftType type, String namespace, Map<String, String> tags) {
        List<DriftPolicy> out = new ArrayList<>();
        for (DriftPolicy p : policies.values()) {
            if (p.getDriftType() == type && p.isDetectionEnabled() && p.shouldApply(namespace, tags)) {
                out.add(p);
            }
        }
        return out;
    }

    /**
     * Compares the {@code columns} lists ({@code {name, type}} maps) of two schema versions. Added columns and type
     * changes are WARNING; any removed column makes it ERROR.
     */
    public Optional<DriftEvent> detectSchemaDrift(String assetId, Map<String, Object> previousSchema,
                                                  Map<String, Object> currentSchema) {
        Map<String, Object> prev = columnTypes(previousSchema);
        Map<String, Object> curr = columnTypes(currentSchema);
        List<String> details = new ArrayList<>();

        TreeSet<String> added = new TreeSet<>(curr.keySet());
        added.removeAll(prev.keySet());
        if (!added.isEmpty()) details.add("Added columns: " + added);

        TreeSet<String> removed = new TreeSet<>(prev.keySet());
        removed.removeAll(curr.keySet());
        if (!removed.isEmpty()) details.add("Removed columns: " + removed);

        TreeSet<String> common = new TreeSet<>(prev.keySet());
        common.retainAll(curr.keySet());
        for (String col : common) {
            if (!Objects.equals(prev.get(col), curr.get(col))) {
                details.add("Type change for " + col + ": " + prev.get(col) + " -> " + curr.get(col));
            }
        }
        if (details.isEmpty()) return Optional.empty();

        DriftSeverity severity = removed.isEmpty() ? DriftSeverity.WARNING : DriftSeverity.ERROR;
        return Optional.of(DriftEvent.open(DriftType.SCHEMA, severity, assetId, previousSchema, currentSchema,
                String.join("; ", details), clock.instant()));
    }

    public Optional<DriftEvent> detectFreshnessDrift(String assetId, Instant lastUpdate) {
        return detectFreshnessDrift(assetId, lastUpdate, DEFAULT_EXPECTED_FREQUENCY_HOURS);
    }

    /**
     * Older than the expected interval is WARNING, older than twice is ERROR, older than five times is CRITICAL.
     */
    public Optional<DriftEvent> detectFreshnessDrift(String assetId, Instant lastUpdate, int expectedFrequencyHours) {
        double ageHours = Duration.between(lastUpdate, clock.instant()).toMillis() / 3_600_000.0;
        if (ageHours <= expectedFrequencyHours) return Optional.empty();

        DriftSeverity severity = DriftSeverity.WARNING;
        if (ageHours > expectedFrequencyHours * 2.0) severity = DriftSeverity.ERROR;
        if (ageHours > expectedFrequencyHours * 5.0) severity = DriftSeverity.CRITICAL;

        String description = String.format(Locale.ROOT, "Data is %.1f hours old, expected refresh every %d hours",
                ageHours, expectedFrequencyHours);
        return Optional.of(DriftEvent.open(DriftType.FRESHNESS, severity, assetId,
                Map.of("expected_frequency_hours", expectedFrequencyHours), Map.of("age_hours", ageHours),
                description, clock.instant()));
    }

    public Optional<DriftEvent> detectQualityDrift(String assetId, Map<String, Double> baseline, Map<String, Double> current) {
        return detectQualityDrift(assetId, baseline, current, DEFAULT_QUALITY_THRESHOLD);
    }

    /**
     * Flags every metric whose relative change from a positive baseline exceeds {@code thresholdPct}.
     * A metric missing from {@code current} counts as 0.
     */
    public Optional<DriftEvent> detectQualityDrift(String assetId, Map<String, Double> baseline,
                                                   Map<String, Double> current, double thresholdPct) {
        List<String> details = new ArrayList<>();
        for (Map.Entry<String, Double> e : baseline.entrySet()) {
            double base = e.getValue() != null ? e.getValue() : 0.0;
            double now = current.getOrDefault(e.getKey(), 0.0);
            if (base > 0) {
                double change = Math.abs(now - base) / base;
                if (change > thresholdPct) {
                    details.add(String.format(Locale.ROOT, "%s: %.2f -> %.2f (%.1f%% change)", e.getKey(), base, now, change * 100));
                }
            }
        }
        if (details.isEmpty()) return Optional.empty();
        return Optional.of(DriftEvent.open(DriftType.QUALITY, DriftSeverity.WARNING, assetId,
                new LinkedHashMap<>(baseline), new LinkedHashMap<>(current), String.join("; ", details), clock.instant()));
    }

    public void recordEvent(DriftEvent event) {
        events.add(event);
        log.info("Drift recorded | asset={} | type={} | severity={} | {}", event.assetId(), event.driftType(),
                event.severity(), event.description());
    }

    /** Open events, optionally for one asset (null means all). */
    public List<DriftEvent> getOpenEvents(String assetId) {
        List<DriftEvent> out = new ArrayList<>();
        for (DriftEvent e : events) {
            if (e.isOpen() && (assetId == null || assetId.equals(e.assetId()))) out.add(e);
        }
        return out;
    }

    public List<DriftEvent> getEvents() {
        return List.copyOf(events);
    }

    /** Marks the event resolved. Returns false if no event has that id. */
    public synchronized boolean resolveEvent(String eventId, String resolvedBy) {
        for (int i = 0; i < events.size(); i++) {
            DriftEvent e = events.get(i);
            if (e.eventId().equals(eventId)) {
                events.set(i, e.resolved(resolvedBy, clock.instant()));
                return true;
            }
        }
        log.warn("Drift event {} not found; nothing resolved", eventId);
        return false;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> columnTypes(Map<String, Object> schema) {
        Map<String, Object> out = new LinkedHashMap<>();
        Object columns = schema != null ? schema.get("columns") : null;
        if (columns instanceof List<?> list) {
            for (Object c : list) {
                if (c instanceof Map<?, ?> col && col.get("name") != null) {
                    out.put(col.get("name").toString(), ((Map<String, Object>) col).get("type"));
                }
            }
        }
        return out;
    }
}
