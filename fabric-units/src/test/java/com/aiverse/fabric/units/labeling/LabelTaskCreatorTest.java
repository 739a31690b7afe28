package com.aiverse.fabric.units.labeling;

import com.aiverse.fabric.contracts.labeling.LabelTaskInput;
import com.aiverse.fabric.contracts.labeling.LabelTaskResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DatasetRegistry;
import com.aiverse.fabric.unit.port.LabelSchemaValidator;
import com.aiverse.fabric.unit.port.SampleSelector;
import com.aiverse.fabric.unit.port.SchemaCheck;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static org.junit.jupiter.api.Assertions.*;

class LabelTaskCreatorTest {

    private final DatasetRegistry datasets = (ref, tenant) -> ref.equals("ds/images") ? Map.of("name", "images") : null;
    private final LabelSchemaValidator validSchema = (ref, tenant) -> SchemaCheck.ok();
    private final SampleSelector threeSamples = (ref, criteria, tenant) -> List.of("s1", "s2", "s3");
    private final TestPorts.Tasks tasks = new TestPorts.Tasks();

    private LabelTaskCreator.Input input(String dataset) {
        return new LabelTaskCreator.Input(new LabelTaskInput(dataset, Map.of("split", "train"), "schema/bbox",
                Map.of("agreement", 0.8)));
    }

    private UnitOutput<LabelTaskResult> run(LabelSchemaValidator schema, SampleSelector selector, String dataset)
            throws PortException {
        return new LabelTaskCreator(datasets, schema, selector, tasks).run(input(dataset), TENANT);
    }

    @Test
    void run_createsPendingTask() throws Exception {
        UnitOutput<LabelTaskResult> out = run(validSchema, threeSamples, "ds/images");

        assertTrue(out.isSuccess());
        assertEquals(3, out.result().sampleCount());
        assertEquals("pending", out.result().status());
        assertEquals(List.of("s1", "s2", "s3"), tasks.lastSamples);
    }

    @Test
    void run_rejectsUnknownDatasetInvalidSchemaAndEmptySelection() throws Exception {
        assertEquals("DATASET_NOT_FOUND", run(validSchema, threeSamples, "ds/other").errorCode());

        UnitOutput<LabelTaskResult> schema = run((ref, tenant) -> SchemaCheck.invalid("no classes"), threeSamples,
                "ds/images");
        assertEquals("SCHEMA_INVALID", schema.errorCode());
        assertEquals("Invalid label schema: no classes", schema.errorMessage());

        assertEquals("EMPTY_SELECTION", run(validSchema, (ref, criteria, tenant) -> List.of(), "ds/images").errorCode());
    }

    @Test
    void run_registryFailure() throws Exception {
        tasks.failure = PortFailure.WRITE_FAILURE;

        assertEquals("REGISTRY_FAILURE", run(validSchema, threeSamples, "ds/images").errorCode());
    }
}
