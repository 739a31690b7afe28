package com.aiverse.fabric.worker.features;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.features.UnitExecutionContext;
import com.aiverse.fabric.signals.FeedbackSignal;
import com.aiverse.fabric.signals.FeedbackSignalEmitter;
import com.aiverse.fabric.signals.FeedbackSignalRegistry;
import com.aiverse.fabric.signals.SignalBus;
import com.aiverse.fabric.signals.SignalFilter;
import com.aiverse.fabric.worker.WorkerTestPorts;
import com.aiverse.fabric.worker.engine.UnitInvoker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SignalEmissionFeatureTest {

    private final SignalBus bus = new SignalBus();
    private final List<FeedbackSignal> received = new ArrayList<>();
    private final TenantContext tenant = WorkerTestPorts.newTenant();
    private FeedbackSignalEmitter emitter;
    private SignalEmissionFeature feature;

    @BeforeEach
    void setUp() {
        FeedbackSignalRegistry registry = new FeedbackSignalRegistry();
        registry.load(null);
        emitter = new FeedbackSignalEmitter(bus, registry);
        feature = new SignalEmissionFeature(emitter);
        bus.subscribe(SignalFilter.all(), received::add);
    }

    private UnitExecutionContext context(Map<String, Object> attributes, boolean succeeded) {
        return new UnitExecutionContext("exec-1", "ProfileData", "DataProfiler", "data-profiling",
                tenant.tenantId(), Map.of(), attributes)
                .withOutcome(succeeded, succeeded ? null : "PROFILE_TIMEOUT", 3L);
    }

    @Test
    void afterFinally_emitsSignalsTriggeredByTheUnit() {
        UUID intentId = UUID.randomUUID();
        Map<String, Object> attributes = Map.of(UnitInvoker.ATTR_TENANT, tenant, UnitInvoker.ATTR_INTENT_ID, intentId);

        feature.afterFinally(context(attributes, true), Map.of("row_count", 2));

        assertEquals(1, received.size());
        FeedbackSignal signal = received.get(0);
        assertEquals("DataProfileDriftAdvisor", signal.name());
        assertEquals(tenant, signal.tenant());
        assertEquals("training-domain", signal.intendedConsumer());
        assertEquals(intentId.toString(), String.valueOf(signal.payload().get("intent_id")));
    }

    @Test
    void afterFinally_conditionFollowsOutcome() {
        Map<String, Object> attributes = Map.of(UnitInvoker.ATTR_TENANT, tenant,
                UnitInvoker.ATTR_INTENT_ID, UUID.randomUUID());

        feature.afterFinally(context(attributes, false), Map.of("error_code", "PROFILE_TIMEOUT"));

        assertTrue(received.isEmpty());
    }

    @Test
    void afterFinally_withoutIntentAttributesEmitsNothing() {
        feature.afterFinally(context(Map.of(UnitInvoker.ATTR_TENANT, tenant), true), Map.of());

        assertTrue(received.isEmpty());
        assertTrue(emitter.getEmissions().isEmpty());
    }
}
