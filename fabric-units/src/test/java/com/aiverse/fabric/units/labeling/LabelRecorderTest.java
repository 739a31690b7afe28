package com.aiverse.fabric.units.labeling;

import com.aiverse.fabric.contracts.labeling.LabelRecordInput;
import com.aiverse.fabric.contracts.labeling.LabelRecordResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.AnnotationStore;
import com.aiverse.fabric.unit.port.LabelValidator;
import com.aiverse.fabric.unit.port.SchemaCheck;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static org.junit.jupiter.api.Assertions.*;

class LabelRecorderTest {

    private final TestPorts.Tasks tasks = new TestPorts.Tasks();
    private final LabelValidator accepting = (value, schemaRef, tenant) -> SchemaCheck.ok();
    private final List<String> stored = new ArrayList<>();
    private final AnnotationStore store = (task, sample, value, annotator, tenant) -> {
        stored.add(task + ":" + sample + "=" + value);
        return "ann-" + stored.size();
    };

    {
        tasks.tasks.put("task-1", Map.of("sample_ids", List.of("s1", "s2"), "schema_ref", "schema/cls"));
    }

    private LabelRecorder.Input input(String task, String sample) {
        return new LabelRecorder.Input(new LabelRecordInput(task, sample, "cat", UUID.randomUUID()));
    }

    @Test
    void run_storesAnnotation() throws Exception {
        UnitOutput<LabelRecordResult> out = new LabelRecorder(tasks, accepting, store).run(input("task-1", "s2"), TENANT);

        assertTrue(out.isSuccess());
        assertNotNull(out.result().annotationId());
        assertEquals(List.of("task-1:s2=cat"), stored);
    }

    @Test
    void run_validatesAgainstTaskSchema() throws Exception {
        LabelValidator validator = (value, schemaRef, tenant) ->
                "schema/cls".equals(schemaRef) ? SchemaCheck.invalid("unknown class " + value) : SchemaCheck.ok();

        UnitOutput<LabelRecordResult> out = new LabelRecorder(tasks, validator, store).run(input("task-1", "s1"), TENANT);

        assertEquals("SCHEMA_VIOLATION", out.errorCode());
        assertEquals("Label violates schema: unknown class cat", out.errorMessage());
        assertTrue(stored.isEmpty());
    }

    @Test
    void run_unknownTaskAndForeignSample() throws Exception {
        LabelRecorder unit = new LabelRecorder(tasks, accepting, store);

        assertEquals("TASK_NOT_FOUND", unit.run(input("task-9", "s1"), TENANT).errorCode());
        UnitOutput<LabelRecordResult> foreign = unit.run(input("task-1", "s7"), TENANT);
        assertEquals("SAMPLE_NOT_IN_TASK", foreign.errorCode());
        assertEquals("Sample not in task: s7", foreign.errorMessage());
    }

    @Test
    void run_storageFailure() throws Exception {
        AnnotationStore failing = (task, sample, value, annotator, tenant) -> {
            throw new PortException(PortFailure.WRITE_FAILURE, "disk full");
        };

        UnitOutput<LabelRecordResult> out = new LabelRecorder(tasks, accepting, failing).run(input("task-1", "s1"), TENANT);

        assertEquals("STORAGE_FAILURE", out.errorCode());
        assertEquals("Failed to store annotation: disk full", out.errorMessage());
    }
}
