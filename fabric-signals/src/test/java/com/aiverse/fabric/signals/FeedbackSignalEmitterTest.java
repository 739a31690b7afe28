package com.aiverse.fabric.signals;

import com.aiverse.fabric.contracts.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackSignalEmitterTest {

    private static final TenantContext TENANT = new TenantContext(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

    private final FeedbackSignalRegistry registry = new FeedbackSignalRegistry();
    private final List<FeedbackSignal> published = new ArrayList<>();

    @BeforeEach
    void loadDefinitions() {
        registry.load(null);
    }

    private FeedbackSignalEmitter emitter() {
        return new FeedbackSignalEmitter(s -> published.add(s), registry);
    }

    @Test
    void emitMetric_buildsPayloadWithIntentAndDomain() {
        UUID intent = UUID.randomUUID();

        EmissionResult r = emitter().emitMetric("DataIngestionVolume", intent, TENANT,
                Map.of("bytes_ingested", 1024, "rows_ingested", 100));

        assertTrue(r.success());
        assertEquals(SignalType.METRIC, r.signalType());
        assertEquals(1, published.size());
        Map<String, Object> payload = published.get(0).payload();
        assertEquals(intent.toString(), payload.get("intent_id"));
        assertEquals("data-fabric", payload.get("domain"));
        assertEquals(1024, payload.get("bytes_ingested"));
        assertSame(TENANT, published.get(0).tenant());
    }

    @Test
    void unknownOrMistypedName_fails() {
        FeedbackSignalEmitter emitter = emitter();

        EmissionResult unknown = emitter.emitMetric("NoSuchMetric", UUID.randomUUID(), TENANT, Map.of());
        EmissionResult wrongType = emitter.emitOutcome("DataIngestionVolume", UUID.randomUUID(), TENANT, Map.of());

        assertFalse(unknown.success());
        assertEquals("Unknown metric: NoSuchMetric", unknown.error());
        assertEquals("Unknown outcome: DataIngestionVolume", wrongType.error());
        assertTrue(published.isEmpty());
    }

    @Test
    void spineFailure_isRecordedAsFailedEmission() {
        FeedbackSignalEmitter emitter = new FeedbackSignalEmitter(s -> {
            throw new IllegalStateException("spine down");
        }, registry);

        EmissionResult r = emitter.emitOutcome("DataQualityGateOutcome", UUID.randomUUID(), TENANT,
                Map.of("gate_result", "pass"));

        assertFalse(r.success());
        assertEquals("spine down", r.error());
        assertEquals(1, emitter.getEmissionCount().get("failed"));
    }

    @Test
    void noSpine_recordsSuccess() {
        FeedbackSignalEmitter emitter = new FeedbackSignalEmitter(null, registry);

        assertTrue(emitter.emitAdvisor("DataLocalityAdvisor", UUID.randomUUID(), TENANT, Map.of(), "mcop-scheduler").success());
        assertEquals(1, emitter.getEmissionCount().get("advisors"));
    }

    @Test
    void emitForExecutionUnit_honoursConditions() {
        FeedbackSignalEmitter emitter = emitter();

        List<EmissionResult> onSuccess = emitter.emitForExecutionUnit("QualityGateEvaluator", UUID.randomUUID(), TENANT,
                Map.of("gate_result", "pass"), true);
        List<EmissionResult> onFailure = emitter.emitForExecutionUnit("QualityGateEvaluator", UUID.randomUUID(), TENANT,
                Map.of("error_code", "EVALUATION_TIMEOUT"), false);

        assertEquals(List.of("DataQualityGateOutcome"), onSuccess.stream().map(EmissionResult::signalName).toList());
        assertEquals(List.of("DataQualityGateOutcome", "DataQualityRegressionAdvisor"),
                onFailure.stream().map(EmissionResult::signalName).toList());
        assertEquals("policy-engine", published.get(2).intendedConsumer());
        assertNull(published.get(0).intendedConsumer());
    }

    @Test
    void counts_andClear() {
        FeedbackSignalEmitter emitter = emitter();
        emitter.emitForExecutionUnit("DataExtractor", UUID.randomUUID(), TENANT, Map.of("bytes_extracted", 10), true);
        emitter.emitForExecutionUnit("DataExtractor", UUID.randomUUID(), TENANT, Map.of(), false);

        Map<String, Integer> counts = emitter.getEmissionCount();
        assertEquals(1, counts.get("total"));
        assertEquals(1, counts.get("metrics"));

        emitter.clear();
        assertTrue(emitter.getEmissions().isEmpty());
    }

    @Test
    void history_keepsMostRecentEmissionsButCountsAll() {
        FeedbackSignalEmitter emitter = new FeedbackSignalEmitter(s -> published.add(s), registry,
                Clock.systemUTC(), 3);
        List<UUID> intents = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            UUID intent = UUID.randomUUID();
            intents.add(intent);
            emitter.emitMetric("DataIngestionVolume", intent, TENANT, Map.of("bytes_ingested", i));
        }

        List<EmissionResult> history = emitter.getEmissions();
        assertEquals(3, history.size());
        assertEquals(5, published.size());
        assertEquals(published.get(2).emissionId(), history.get(0).emissionId());
        assertEquals(published.get(4).emissionId(), history.get(2).emissionId());
        assertEquals(5, emitter.getEmissionCount().get("total"));
        assertEquals(5, emitter.getEmissionCount().get("metrics"));
        assertEquals(0, emitter.getEmissionCount().get("failed"));

        emitter.clear();
        assertEquals(0, emitter.getEmissionCount().get("total"));
    }

    @Test
    void history_limitMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new FeedbackSignalEmitter(null, registry, Clock.systemUTC(), 0));
    }
}
