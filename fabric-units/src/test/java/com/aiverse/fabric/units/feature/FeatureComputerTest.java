package com.aiverse.fabric.units.feature;

import com.aiverse.fabric.contracts.feature.FeatureComputeInput;
import com.aiverse.fabric.contracts.feature.FeatureComputeResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.FeatureDefinitionResolver;
import com.aiverse.fabric.unit.port.FeatureEngine;
import com.aiverse.fabric.unit.port.FeatureEngine.FeatureOutput;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static com.aiverse.fabric.units.TestPorts.bytes;
import static org.junit.jupiter.api.Assertions.*;

class FeatureComputerTest {

    private final TestPorts.Staging staging = new TestPorts.Staging().put("events", "e");
    private final FeatureDefinitionResolver definitions = (ref, tenant) -> Map.of("name", "clicks_7d");
    private final FeatureEngine engine = (src, def, keys, start, end) -> new FeatureOutput(bytes("f"), 50, 150);
    private final FeatureComputer.Input input = new FeatureComputer.Input(new FeatureComputeInput(
            "events", "def/clicks", List.of("user_id"),
            Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-08T00:00:00Z"), "features"));

    @Test
    void run_computesAndStagesFeatures() throws Exception {
        UnitOutput<FeatureComputeResult> out = new FeatureComputer(definitions, staging, engine).run(input, TENANT);

        assertTrue(out.isSuccess());
        assertEquals(50, out.result().entitiesComputed());
        assertEquals(150, out.result().featureValuesCount());
        assertNotNull(staging.data.get("features"));
    }

    @Test
    void run_missingDefinitionEitherWay() throws Exception {
        FeatureDefinitionResolver absent = (ref, tenant) -> null;
        FeatureDefinitionResolver notFound = (ref, tenant) -> {
            throw new PortException(PortFailure.NOT_FOUND, ref);
        };

        assertEquals("DEFINITION_NOT_FOUND", new FeatureComputer(absent, staging, engine).run(input, TENANT).errorCode());
        assertEquals("DEFINITION_NOT_FOUND", new FeatureComputer(notFound, staging, engine).run(input, TENANT).errorCode());
    }

    @Test
    void run_mapsEngineFailures() throws Exception {
        assertEquals("COMPUTATION_ERROR", engineFailing(PortFailure.COMPUTATION).errorCode());
        assertEquals("ENTITY_KEY_MISSING", engineFailing(PortFailure.KEY_MISMATCH).errorCode());
    }

    @Test
    void run_outputWriteFailure() throws Exception {
        staging.writeFailure = PortFailure.WRITE_FAILURE;

        UnitOutput<FeatureComputeResult> out = new FeatureComputer(definitions, staging, engine).run(input, TENANT);

        assertEquals("OUTPUT_WRITE_FAILURE", out.errorCode());
        assertTrue(out.errorMessage().startsWith("Failed to write features: "));
    }

    private UnitOutput<FeatureComputeResult> engineFailing(PortFailure failure) throws PortException {
        return new FeatureComputer(definitions, staging, (src, def, keys, start, end) -> {
            throw new PortException(failure, "engine");
        }).run(input, TENANT);
    }
}
