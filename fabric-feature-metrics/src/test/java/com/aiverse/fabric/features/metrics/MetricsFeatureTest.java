package com.aiverse.fabric.features.metrics;

import com.aiverse.fabric.features.FeatureRegistry;
import com.aiverse.fabric.features.ResolvedFeatures;
import com.aiverse.fabric.features.UnitExecutionContext;
import com.aiverse.fabric.features.UnitFeatureRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsFeatureTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final MetricsFeature feature = new MetricsFeature(meters);

    @AfterEach
    void tearDown() {
        FeatureRegistry.getInstance().clear();
    }

    private static UnitExecutionContext ctx(String unit, String capability) {
        return new UnitExecutionContext(unit, capability, "org/ws");
    }

    @Test
    void success_countsAndTimes() {
        feature.afterFinally(ctx("DataProfiler", "data-profiling").withOutcome(true, null, 40L),
                Map.of("low_confidence", true, "is_truncated", false));

        assertEquals(1.0, meters.get("fabric.unit.executions")
                .tags("tenant", "org/ws", "unit", "DataProfiler", "success", "true").counter().count());
        assertEquals(40.0, meters.get("fabric.unit.execution").tag("capability", "data-profiling")
                .timer().totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1.0, meters.get("fabric.unit.flags").tag("flag", "low_confidence").counter().count());
        assertTrue(meters.find("fabric.unit.flags").tag("flag", "is_truncated").counters().isEmpty());
        assertNull(meters.find("fabric.unit.errors").counter());
    }

    @Test
    void error_countsByErrorCode() {
        UnitExecutionContext failed = ctx("DataExtractor", "data-extraction").withOutcome(false, "QUOTA_EXCEEDED", 5L);

        feature.afterFinally(failed, null);
        feature.afterFinally(failed, null);

        assertEquals(2.0, meters.get("fabric.unit.errors").tag("error_code", "QUOTA_EXCEEDED").counter().count());
        assertEquals(2.0, meters.get("fabric.unit.executions").tag("success", "false").counter().count());
    }

    @Test
    void registeredFeature_appliesToEveryUnit() {
        FeatureRegistry registry = FeatureRegistry.getInstance();
        registry.register(feature);
        UnitFeatureRunner runner = new UnitFeatureRunner(registry);
        UnitExecutionContext done = ctx("LineageEdgeWriter", "lineage-recording").withOutcome(true, null, 1L);

        ResolvedFeatures resolved = runner.resolve(done);
        runner.runFinally(resolved, done, Map.of());

        assertEquals(List.of("metrics"), resolved.getFinally());
        assertTrue(resolved.getPre().isEmpty());
        assertEquals(1.0, meters.get("fabric.unit.executions").tag("unit", "LineageEdgeWriter").counter().count());
    }
}
