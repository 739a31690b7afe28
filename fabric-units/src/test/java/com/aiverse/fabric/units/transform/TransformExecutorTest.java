package com.aiverse.fabric.units.transform;

import com.aiverse.fabric.contracts.transform.TransformInput;
import com.aiverse.fabric.contracts.transform.TransformResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.TransformEngine;
import com.aiverse.fabric.unit.port.TransformEngine.TransformOutput;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static com.aiverse.fabric.units.TestPorts.bytes;
import static org.junit.jupiter.api.Assertions.*;

class TransformExecutorTest {

    private final TestPorts.Staging staging = new TestPorts.Staging().put("in", "raw");
    private final Map<String, Object> definition = Map.of("op", "filter", "expr", "amount > 0");
    private final TransformExecutor.Input input = new TransformExecutor.Input(
            new TransformInput("in", definition, Map.of("limit", 10), "out"));

    @Test
    void run_writesOutputAndReportsHash() throws Exception {
        TransformEngine engine = (data, def, params) -> new TransformOutput(bytes("filtered"), 10, 7);

        UnitOutput<TransformResult> out = new TransformExecutor(staging, engine).run(input, TENANT);

        assertTrue(out.isSuccess());
        assertEquals(10, out.result().rowsProcessed());
        assertEquals(7, out.result().rowsOutput());
        assertEquals("out", out.result().outputStagingRef());
        assertEquals(16, out.result().transformationHash().length());
        assertArrayEquals(bytes("filtered"), staging.data.get("out"));
    }

    @Test
    void transformationHash_isIndependentOfKeyOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("op", "filter");
        a.put("expr", "x");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("expr", "x");
        b.put("op", "filter");

        assertEquals(TransformExecutor.transformationHash(a, Map.of()),
                TransformExecutor.transformationHash(b, Map.of()));
        assertNotEquals(TransformExecutor.transformationHash(a, Map.of()),
                TransformExecutor.transformationHash(a, Map.of("p", 1)));
    }

    @Test
    void run_mapsEngineFailures() throws Exception {
        assertEquals("TRANSFORM_ERROR", engineFailing(PortFailure.COMPUTATION).errorCode());
        assertEquals("TRANSFORM_ERROR", engineFailing(PortFailure.INVALID).errorCode());
        assertEquals("RESOURCE_EXHAUSTED", engineFailing(PortFailure.MEMORY_EXHAUSTED).errorCode());
    }

    @Test
    void run_mapsStagingFailures() throws Exception {
        TransformEngine engine = (data, def, params) -> new TransformOutput(data, 1, 1);

        staging.writeFailure = PortFailure.QUOTA_EXCEEDED;
        assertEquals("OUTPUT_WRITE_FAILURE", new TransformExecutor(staging, engine).run(input, TENANT).errorCode());

        staging.readFailure = PortFailure.READ_FAILURE;
        assertEquals("INPUT_READ_FAILURE", new TransformExecutor(staging, engine).run(input, TENANT).errorCode());
    }

    private UnitOutput<TransformResult> engineFailing(PortFailure failure) throws PortException {
        return new TransformExecutor(staging, (data, def, params) -> {
            throw new PortException(failure, "engine");
        }).run(input, TENANT);
    }
}
