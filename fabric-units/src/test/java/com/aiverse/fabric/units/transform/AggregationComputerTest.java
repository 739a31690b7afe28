package com.aiverse.fabric.units.transform;

import com.aiverse.fabric.contracts.transform.AggregationInput;
import com.aiverse.fabric.contracts.transform.AggregationResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.AggregationEngine.AggregationOutput;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static com.aiverse.fabric.units.TestPorts.bytes;
import static org.junit.jupiter.api.Assertions.*;

class AggregationComputerTest {

    private final TestPorts.Staging staging = new TestPorts.Staging().put("sales", "rows");
    private final AggregationComputer.Input input = new AggregationComputer.Input(new AggregationInput(
            "sales", List.of("region"), Map.of("amount", "sum"), "sales_by_region"));

    @Test
    void run_reportsGroups() throws Exception {
        AggregationComputer unit = new AggregationComputer(staging, (data, groupBy, aggs) -> {
            assertEquals(List.of("region"), groupBy);
            return new AggregationOutput(bytes("agg"), 4);
        });

        UnitOutput<AggregationResult> out = unit.run(input, TENANT);

        assertTrue(out.isSuccess());
        assertEquals(4, out.result().groupsComputed());
        assertEquals("sales_by_region", out.result().outputStagingRef());
    }

    @Test
    void run_mapsEngineFailures() throws Exception {
        UnitOutput<AggregationResult> invalid = engineFailing(PortFailure.INVALID);
        assertEquals("INVALID_AGGREGATION", invalid.errorCode());
        assertEquals("Invalid aggregation: engine", invalid.errorMessage());
        assertEquals("MEMORY_EXHAUSTED", engineFailing(PortFailure.MEMORY_EXHAUSTED).errorCode());
    }

    @Test
    void run_unmappedEngineFailurePropagates() {
        assertThrows(PortException.class, () -> engineFailing(PortFailure.TIMEOUT));
    }

    private UnitOutput<AggregationResult> engineFailing(PortFailure failure) throws PortException {
        return new AggregationComputer(staging, (data, groupBy, aggs) -> {
            throw new PortException(failure, "engine");
        }).run(input, TENANT);
    }
}
