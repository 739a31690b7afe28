package com.aiverse.fabric.ledger;

import com.aiverse.fabric.features.FeatureRegistry;
import com.aiverse.fabric.features.ResolvedFeatures;
import com.aiverse.fabric.features.UnitExecutionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LedgerFeatureTest {

    @AfterEach
    void tearDown() {
        FeatureRegistry.getInstance().clear();
    }

    private static ExecutionLedger ledgerWithExecution(InMemoryExecutionStore store) {
        ExecutionLedger ledger = new ExecutionLedger(store);
        ledger.submitted(ExecutionRecord.submitted("exec-1", "intent-1", "org/ws", "profile", "data-fabric", "t1",
                Map.of(), Instant.parse("2026-03-01T10:00:00Z")));
        return ledger;
    }

    @Test
    void afterFinally_recordsUnitOutcome() {
        InMemoryExecutionStore store = new InMemoryExecutionStore();
        LedgerFeature feature = new LedgerFeature(ledgerWithExecution(store));
        UnitExecutionContext ctx = new UnitExecutionContext("exec-1", "profile", "DataProfiler", "data-profiling",
                "org/ws", Map.of(), Map.of(LedgerFeature.ATTR_INPUT, Map.of("dataset_ref", "orders")));

        feature.afterFinally(ctx.withOutcome(false, "DATA_NOT_FOUND", 42),
                Map.of("error_code", "DATA_NOT_FOUND", "error_message", "dataset orders not found"));

        UnitRecord unit = store.find("exec-1").orElseThrow().units().get(0);
        assertEquals("DataProfiler", unit.unitId());
        assertEquals("data-profiling", unit.capabilityType());
        assertFalse(unit.succeeded());
        assertEquals("DATA_NOT_FOUND", unit.errorCode());
        assertEquals("dataset orders not found", unit.errorMessage());
        assertEquals("orders", unit.input().get("dataset_ref"));
        assertEquals(42, unit.durationMs());
    }

    @Test
    void afterFinally_withoutExecutionId_recordsNothing() {
        InMemoryExecutionStore store = new InMemoryExecutionStore();
        LedgerFeature feature = new LedgerFeature(ledgerWithExecution(store));
        UnitExecutionContext ctx = new UnitExecutionContext("DataProfiler", "data-profiling", "org/ws");

        feature.afterFinally(ctx.withOutcome(true, null, 5), Map.of("result", Map.of()));

        assertTrue(store.find("exec-1").orElseThrow().units().isEmpty());
    }

    @Test
    void registersAsFinallyFeatureForEveryUnit() {
        FeatureRegistry.getInstance().register(new LedgerFeature(null));
        ResolvedFeatures resolved = FeatureRegistry.getInstance().resolve("MergeComputer", "merge-computation");
        assertEquals(1, resolved.getFinally().size());
        assertTrue(resolved.getPre().isEmpty());
    }
}
