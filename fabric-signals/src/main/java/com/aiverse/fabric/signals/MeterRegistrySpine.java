package com.aiverse.fabric.signals;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * Spine that records signals as Micrometer meters: a counter {@code fabric.signals} per signal, type, domain and
 * tenant, and a distribution summary {@code fabric.signal.value} for each numeric payload value of a metric.
 */
public final class MeterRegistrySpine implements ObservabilitySpine {

    private final MeterRegistry registry;

    public MeterRegistrySpine(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public boolean publish(FeedbackSignal signal) {
        String tenant = signal.tenant() != null ? signal.tenant().tenantId() : "unknown";
        registry.counter("fabric.signals",
                "signal", signal.name(),
                "type", signal.signalType().value(),
                "domain", signal.domain(),
                "tenant", tenant
        ).increment();
        if (signal.signalType() == SignalType.METRIC) {
            for (Map.Entry<String, Object> e : signal.payload().entrySet()) {
                if (e.getValue() instanceof Number n) {
                    registry.summary("fabric.signal.value",
                            "signal", signal.name(), "field", e.getKey(), "tenant", tenant).record(n.doubleValue());
                }
            }
        }
        return true;
    }
}
