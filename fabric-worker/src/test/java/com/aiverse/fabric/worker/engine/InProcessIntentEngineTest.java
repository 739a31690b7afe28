package com.aiverse.fabric.worker.engine;

import com.aiverse.fabric.config.TenantConfigRegistry;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.features.FeatureRegistry;
import com.aiverse.fabric.features.UnitFeatureRunner;
import com.aiverse.fabric.ledger.ExecutionLedger;
import com.aiverse.fabric.ledger.ExecutionRecord;
import com.aiverse.fabric.ledger.ExecutionStatus;
import com.aiverse.fabric.ledger.InMemoryExecutionStore;
import com.aiverse.fabric.ledger.LedgerFeature;
import com.aiverse.fabric.ledger.UnitRecord;
import com.aiverse.fabric.mcop.IntentDecomposition;
import com.aiverse.fabric.mcop.McopException;
import com.aiverse.fabric.mcop.UnitReference;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitRegistry;
import com.aiverse.fabric.unit.ExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.units.quality.DataProfiler;
import com.aiverse.fabric.worker.WorkerTestPorts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class InProcessIntentEngineTest {

    private static final UnitReference PROFILER = new UnitReference("DataProfiler", "data-profiling", Map.of(
            "dataset_ref", "profile_input.dataset_ref",
            "sample_size", "profile_input.sample_size"));

    private final UnitRegistry units = UnitRegistry.getInstance();
    private final FeatureRegistry features = FeatureRegistry.getInstance();
    private final WorkerTestPorts ports = new WorkerTestPorts();
    private final TenantContext tenant = WorkerTestPorts.newTenant();
    private final ExecutionLedger ledger = new ExecutionLedger(new InMemoryExecutionStore());
    private UnitInvoker invoker;

    @BeforeEach
    void setUp() {
        units.register("default", new DataProfiler(ports.datasets, ports.profiles));
        features.register(new LedgerFeature(ledger));
        invoker = new UnitInvoker(units, new UnitFeatureRunner(features), TenantConfigRegistry.getInstance());
    }

    @AfterEach
    void tearDown() {
        units.clear();
        features.clear();
    }

    private IntentDecomposition decomposition(List<UnitReference> refs) {
        return new IntentDecomposition(UUID.randomUUID(), UUID.randomUUID(), "ProfileData", "data-fabric", tenant,
                Map.of("dataset_ref", "ds-1", "sample_size", 50), refs);
    }

    @Test
    void decomposeIntent_runsUnitsAndRecordsSucceeded() throws McopException {
        InProcessIntentEngine engine = new InProcessIntentEngine(invoker, ledger, null);
        IntentDecomposition d = decomposition(List.of(PROFILER));

        assertTrue(engine.decomposeIntent(d));

        ExecutionRecord record = ledger.find(d.executionId().toString()).orElseThrow();
        assertEquals(ExecutionStatus.SUCCEEDED, record.status());
        assertEquals(tenant.tenantId(), record.tenantId());
        assertNotNull(record.startedAt());
        assertNotNull(record.endedAt());
        assertNull(record.errorMessage());
        assertEquals(1, record.units().size());
        UnitRecord unit = record.units().get(0);
        assertEquals("DataProfiler", unit.unitId());
        assertTrue(unit.succeeded());
        assertEquals(Map.of("dataset_ref", "ds-1", "sample_size", 50), unit.input().get("profile_input"));
    }

    @Test
    void decomposeIntent_mixedOutcomesArePartial() throws McopException {
        InProcessIntentEngine engine = new InProcessIntentEngine(invoker, ledger, Runnable::run);
        UnitReference missing = new UnitReference("DataJoiner", "data-joining", Map.of());
        IntentDecomposition d = decomposition(List.of(missing, PROFILER));

        engine.decomposeIntent(d);

        ExecutionRecord record = ledger.find(d.executionId().toString()).orElseThrow();
        assertEquals(ExecutionStatus.PARTIAL, record.status());
        assertEquals("DataJoiner: EXECUTION_FAILED Execution unit not available: DataJoiner", record.errorMessage());
        assertEquals(1, record.units().size());
    }

    @Test
    void decomposeIntent_allUnitsFailingIsFailed() throws McopException {
        ports.datasets.failure = PortFailure.READ_FAILURE;
        InProcessIntentEngine engine = new InProcessIntentEngine(invoker, ledger, null);
        IntentDecomposition d = decomposition(List.of(PROFILER));

        engine.decomposeIntent(d);

        ExecutionRecord record = ledger.find(d.executionId().toString()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, record.status());
        assertTrue(record.errorMessage().startsWith("DataProfiler: DATASET_READ_FAILURE"));
        assertEquals("DATASET_READ_FAILURE", record.units().get(0).errorCode());
    }

    @Test
    void decomposeIntent_queuedExecutionStaysSubmittedUntilRun() throws McopException {
        List<Runnable> queued = new ArrayList<>();
        InProcessIntentEngine engine = new InProcessIntentEngine(invoker, ledger, queued::add);
        IntentDecomposition d = decomposition(List.of(PROFILER));

        engine.decomposeIntent(d);
        assertEquals(ExecutionStatus.SUBMITTED, ledger.find(d.executionId().toString()).orElseThrow().status());

        queued.forEach(Runnable::run);
        assertEquals(ExecutionStatus.SUCCEEDED, ledger.find(d.executionId().toString()).orElseThrow().status());
    }

    @Test
    void decomposeIntent_rejectedWorkFailsTheExecution() {
        InProcessIntentEngine engine = new InProcessIntentEngine(invoker, ledger, r -> {
            throw new RejectedExecutionException("pool shut down");
        });
        IntentDecomposition d = decomposition(List.of(PROFILER));

        assertThrows(McopException.class, () -> engine.decomposeIntent(d));
        assertEquals(ExecutionStatus.FAILED, ledger.find(d.executionId().toString()).orElseThrow().status());
    }

    @Test
    void decomposeIntent_unrenderableResultFailsInsteadOfStayingRunning() throws McopException {
        units.register("default", new OpaqueResultUnit());
        List<Runnable> queued = new ArrayList<>();
        InProcessIntentEngine engine = new InProcessIntentEngine(invoker, ledger, queued::add);
        IntentDecomposition d = decomposition(List.of(new UnitReference("OpaqueResult", "opaque", Map.of())));

        engine.decomposeIntent(d);
        queued.forEach(Runnable::run);

        ExecutionRecord record = ledger.find(d.executionId().toString()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, record.status());
        assertTrue(record.errorMessage().startsWith("OpaqueResult: EXECUTION_FAILED Unit result could not be serialized"),
                record.errorMessage());
        assertEquals("EXECUTION_FAILED", record.units().get(0).errorCode());
    }

    /** Returns a result Jackson has no serializer for. */
    private static final class OpaqueResultUnit implements ExecutionUnit {
        @Override
        public String id() {
            return "OpaqueResult";
        }

        @Override
        public String capabilityType() {
            return "opaque";
        }

        @Override
        public UnitOutput<?> execute(Map<String, Object> inputs, TenantContext tenant) {
            return UnitOutput.success(Map.of("value", new Opaque()));
        }
    }

    private static final class Opaque {
    }
}
