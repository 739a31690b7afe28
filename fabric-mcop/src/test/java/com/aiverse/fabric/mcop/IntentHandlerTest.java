package com.aiverse.fabric.mcop;

import com.aiverse.fabric.contracts.TenantContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class IntentHandlerTest {

    private static final TenantContext TENANT = new TenantContext(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

    @Test
    void supportsAllFifteenIntents() {
        IntentHandler handler = new IntentHandler();

        assertEquals(15, handler.getIntentCount());
        List<String> intents = handler.getSupportedIntents();
        assertEquals("BranchDataset", intents.get(0));
        assertTrue(intents.contains("IngestData"));
        assertTrue(intents.contains("QueryLocality"));
        assertFalse(handler.isSupportedIntent("DeleteEverything"));
        assertFalse(handler.isSupportedIntent(null));
    }

    @Test
    void ingestData_decomposesIntoExtractWriteLineage() {
        UUID intentId = UUID.randomUUID();

        IntentHandlingResult r = new IntentHandler().handleIntent("IngestData", intentId, TENANT, Map.of());

        assertTrue(r.success());
        assertEquals(3, r.unitCount());
        assertEquals(List.of("DataExtractor", "DataWriter", "LineageEdgeWriter"),
                r.executionUnits().stream().map(u -> u.get("name")).toList());
        assertEquals("data-extraction", r.executionUnits().get(0).get("capability_type"));
        assertEquals("data-fabric", r.executionUnits().get(0).get("domain"));
        Map<String, Object> map = r.toMap();
        assertEquals(intentId.toString(), map.get("intent_id"));
        assertEquals(3, map.get("unit_count"));
    }

    @Test
    void unsupportedIntent_failsWithMessage() {
        IntentHandlingResult r = new IntentHandler().handleIntent("FlyToMoon", UUID.randomUUID(), TENANT, Map.of());

        assertFalse(r.success());
        assertEquals("Unsupported intent type: FlyToMoon", r.error());
        assertEquals(Map.of("success", false, "error", "Unsupported intent type: FlyToMoon", "domain", "data-fabric"), r.toMap());
    }

    @Test
    void submitsDecompositionToEngine() {
        List<IntentDecomposition> submitted = new ArrayList<>();
        IntentHandler handler = new IntentHandler(d -> submitted.add(d));
        UUID intentId = UUID.randomUUID();
        UUID executionId = UUID.randomUUID();

        IntentHandlingResult r = handler.handleIntent("ProfileData", intentId, executionId, TENANT, Map.of("dataset_ref", "ds-1"));

        assertTrue(r.success());
        assertEquals(1, submitted.size());
        IntentDecomposition d = submitted.get(0);
        assertEquals(intentId, d.intentId());
        assertEquals(executionId, d.executionId());
        assertEquals(executionId.toString(), r.toMap().get("execution_id"));
        assertEquals("ProfileData", d.intentType());
        assertSame(TENANT, d.tenant());
        assertEquals("DataProfiler", d.units().get(0).name());
        assertEquals("ds-1", d.inputs().get("dataset_ref"));
    }

    @Test
    void engineFailureOrRejection_failsResult() {
        IntentHandler failing = new IntentHandler(d -> {
            throw new McopException("engine down");
        });
        IntentHandler rejecting = new IntentHandler(d -> false);

        IntentHandlingResult failed = failing.handleIntent("IngestData", UUID.randomUUID(), TENANT, Map.of());
        IntentHandlingResult rejected = rejecting.handleIntent("IngestData", UUID.randomUUID(), TENANT, Map.of());

        assertFalse(failed.success());
        assertEquals("Failed to submit decomposition: engine down", failed.error());
        assertFalse(rejected.success());
        assertTrue(rejected.error().startsWith("Failed to submit decomposition"));
    }

    @Test
    void everyIntentHasAtLeastOneUnit() {
        IntentHandler handler = new IntentHandler();
        for (String intent : handler.getSupportedIntents()) {
            List<UnitReference> units = handler.getExecutionUnitsForIntent(intent);
            assertNotNull(units, intent);
            assertFalse(units.isEmpty(), intent);
        }
    }
}
