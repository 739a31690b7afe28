package com.aiverse.fabric.features.metrics;

import com.aiverse.fabric.annotations.FabricFeature;
import com.aiverse.fabric.annotations.FeaturePhase;
import com.aiverse.fabric.annotations.ResourceCleanup;
import com.aiverse.fabric.features.FinallyCall;
import com.aiverse.fabric.features.UnitExecutionContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records unit execution metrics after every invocation: an execution counter and a timer per tenant, unit and
 * outcome, an error counter per error code, and a counter per output flag (truncated, low confidence,
 * inconclusive, stale signals).
 * <p>
 * Without an injected registry a shared {@link SimpleMeterRegistry} is created lazily on first use (CAS) and reused.
 */
@FabricFeature(name = "metrics", phase = FeaturePhase.FINALLY, applicableUnits = { "*" })
public final class MetricsFeature implements FinallyCall, ResourceCleanup {

    private static final AtomicReference<MeterRegistry> SHARED = new AtomicReference<>();

    private static final List<String> FLAG_KEYS = List.of("is_truncated", "low_confidence", "is_inconclusive", "has_stale_signals");

    private final MeterRegistry injected;

    public MetricsFeature() {
        this(null);
    }

    public MetricsFeature(MeterRegistry registry) {
        this.injected = registry;
    }

    private static MeterRegistry sharedRegistry() {
        MeterRegistry existing = SHARED.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (SHARED.compareAndSet(null, created)) {
            return created;
        }
        return SHARED.get();
    }

    /** Registry the feature records into. */
    public MeterRegistry getRegistry() {
        return injected != null ? injected : sharedRegistry();
    }

    @Override
    public void afterFinally(UnitExecutionContext ctx, Object unitResult) {
        MeterRegistry registry = getRegistry();
        String tenant = nullToUnknown(ctx.getTenantId());
        String unit = nullToUnknown(ctx.getUnitId());
        String success = String.valueOf(ctx.isExecutionSucceeded());

        registry.counter("fabric.unit.executions",
                "tenant", tenant,
                "unit", unit,
                "success", success
        ).increment();

        Timer.builder("fabric.unit.execution")
                .tag("tenant", tenant)
                .tag("unit", unit)
                .tag("capability", nullToUnknown(ctx.getCapabilityType()))
                .tag("success", success)
                .register(registry)
                .record(ctx.getDurationMs(), TimeUnit.MILLISECONDS);

        if (ctx.getErrorCode() != null) {
            registry.counter("fabric.unit.errors",
                    "tenant", tenant, "unit", unit, "error_code", ctx.getErrorCode()).increment();
        }
        if (unitResult instanceof Map<?, ?> output) {
            for (String flag : FLAG_KEYS) {
                if (Boolean.TRUE.equals(output.get(flag))) {
                    registry.counter("fabric.unit.flags", "tenant", tenant, "unit", unit, "flag", flag).increment();
                }
            }
        }
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }

    @Override
    public void onExit() {
        MeterRegistry shared = SHARED.getAndSet(null);
        if (shared != null) {
            shared.close();
        }
    }
}
