package com.aiverse.fabric.catalog.drift;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DriftDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final DriftDetector detector = DriftDetector.standard(Clock.fixed(NOW, ZoneOffset.UTC));

    private static Map<String, Object> schema(Map<String, String> columns) {
        List<Map<String, Object>> cols = columns.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> Map.<String, Object>of("name", e.getKey(), "type", e.getValue()))
                .toList();
        return Map.of("columns", cols);
    }

    @Test
    void schemaDrift_addedAndTypeChangeIsWarning() {
        DriftEvent event = detector.detectSchemaDrift("orders",
                schema(Map.of("id", "bigint", "amount", "int")),
                schema(Map.of("id", "bigint", "amount", "decimal", "currency", "string"))).orElseThrow();

        assertEquals(DriftType.SCHEMA, event.driftType());
        assertEquals(DriftSeverity.WARNING, event.severity());
        assertEquals("Added columns: [currency]; Type change for amount: int -> decimal", event.description());
        assertEquals(DriftEventStatus.OPEN, event.status());
    }

    @Test
    void schemaDrift_removedColumnIsError() {
        DriftEvent event = detector.detectSchemaDrift("orders",
                schema(Map.of("id", "bigint", "email", "string")),
                schema(Map.of("id", "bigint"))).orElseThrow();
        assertEquals(DriftSeverity.ERROR, event.severity());
        assertEquals("Removed columns: [email]", event.description());
    }

    @Test
    void schemaDrift_identicalSchemasGiveNothing() {
        Map<String, Object> s = schema(Map.of("id", "bigint"));
        assertTrue(detector.detectSchemaDrift("orders", s, s).isEmpty());
    }

    @Test
    void freshnessDrift_severityScalesWithAge() {
        assertTrue(detector.detectFreshnessDrift("a", NOW.minus(Duration.ofHours(24))).isEmpty());
        assertEquals(DriftSeverity.WARNING, detector.detectFreshnessDrift("a", NOW.minus(Duration.ofHours(30))).orElseThrow().severity());
        assertEquals(DriftSeverity.ERROR, detector.detectFreshnessDrift("a", NOW.minus(Duration.ofHours(49))).orElseThrow().severity());
        DriftEvent critical = detector.detectFreshnessDrift("a", NOW.minus(Duration.ofHours(13)), 2).orElseThrow();
        assertEquals(DriftSeverity.CRITICAL, critical.severity());
        assertEquals("Data is 13.0 hours old, expected refresh every 2 hours", critical.description());
    }

    @Test
    void qualityDrift_flagsMetricsBeyondThreshold() {
        DriftEvent event = detector.detectQualityDrift("orders",
                Map.of("completeness", 0.98, "uniqueness", 1.0),
                Map.of("completeness", 0.80, "uniqueness", 0.99)).orElseThrow();
        assertEquals(DriftType.QUALITY, event.driftType());
        assertEquals("completeness: 0.98 -> 0.80 (18.4% change)", event.description());
        assertTrue(detector.detectQualityDrift("orders", Map.of("completeness", 0.98), Map.of("completeness", 0.97)).isEmpty());
    }

    @Test
    void qualityDrift_missingCurrentMetricCountsAsZero() {
        assertTrue(detector.detectQualityDrift("orders", Map.of("validity", 0.9), Map.of()).isPresent());
    }

    @Test
    void recordAndResolve() {
        DriftEvent e1 = detector.detectFreshnessDrift("orders", NOW.minus(Duration.ofDays(2))).orElseThrow();
        DriftEvent e2 = detector.detectFreshnessDrift("customers", NOW.minus(Duration.ofDays(2))).orElseThrow();
        detector.recordEvent(e1);
        detector.recordEvent(e2);
        assertEquals(2, detector.getOpenEvents(null).size());
        assertEquals(List.of(e1), detector.getOpenEvents("orders"));

        assertTrue(detector.resolveEvent(e1.eventId(), "steward@example.com"));
        assertTrue(detector.getOpenEvents("orders").isEmpty());
        DriftEvent resolved = detector.getEvents().get(0);
        assertEquals(DriftEventStatus.RESOLVED, resolved.status());
        assertEquals("steward@example.com", resolved.resolvedBy());
        assertEquals(NOW, resolved.resolvedAt());
        assertFalse(detector.resolveEvent("missing", "x"));
    }

    @Test
    void standardPolicies_selectByTags() {
        assertEquals(4, detector.getPolicies().size());
        List<DriftPolicy> prod = detector.applicablePolicies(DriftType.SCHEMA, "org/ws", Map.of("environment", "production"));
        assertEquals(1, prod.size());
        assertTrue(prod.get(0).isBlockDownstream());
        assertTrue(prod.get(0).isRequireApproval());
        assertEquals(1, detector.applicablePolicies(DriftType.FRESHNESS, "org/ws", Map.of("data_quality", "gold")).size());
        assertTrue(detector.applicablePolicies(DriftType.QUALITY, "org/ws", Map.of("data_quality", "silver")).isEmpty());
    }

    @Test
    void policy_namespacePrefixScope() {
        DriftPolicy policy = DriftPolicy.builder("finance_only", DriftType.METADATA)
                .applyToNamespaces(List.of("acme/finance"))
                .build();
        assertTrue(policy.shouldApply("acme/finance/ledger", Map.of()));
        assertFalse(policy.shouldApply("acme/hr", Map.of()));
    }
}
