package com.aiverse.fabric.units.labeling;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.labeling.LabelRecordInput;
import com.aiverse.fabric.contracts.labeling.LabelRecordResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.AnnotationStore;
import com.aiverse.fabric.unit.port.LabelTaskRegistry;
import com.aiverse.fabric.unit.port.LabelValidator;
import com.aiverse.fabric.unit.port.SchemaCheck;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@FabricUnit(id = "LabelRecorder", capabilityType = "label-recording",
        description = "Records an annotation for a sample of a labeling task",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "write-store",
        tags = {"labeling", "annotation", "stateless"})
public final class LabelRecorder extends TypedExecutionUnit<LabelRecorder.Input, LabelRecordResult> {

    public record Input(@JsonProperty("record_input") LabelRecordInput recordInput) {
        public Input {
            Objects.requireNonNull(recordInput, "record_input");
        }
    }

    private final LabelTaskRegistry taskRegistry;
    private final LabelValidator labelValidator;
    private final AnnotationStore annotationStore;

    public LabelRecorder(LabelTaskRegistry taskRegistry, LabelValidator labelValidator,
                         AnnotationStore annotationStore) {
        super(Input.class);
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry");
        this.labelValidator = Objects.requireNonNull(labelValidator, "labelValidator");
        this.annotationStore = Objects.requireNonNull(annotationStore, "annotationStore");
    }

    @Override
    public UnitOutput<LabelRecordResult> run(Input input, TenantContext tenant) throws PortException {
        LabelRecordInput in = input.recordInput();

        Map<String, Object> task = taskRegistry.getTask(in.taskRef(), tenant);
        if (task == null) {
            return UnitOutput.failure("TASK_NOT_FOUND", "Task not found: " + in.taskRef());
        }
        if (!(task.get("sample_ids") instanceof Collection<?> sampleIds) || !sampleIds.contains(in.sampleId())) {
            return UnitOutput.failure("SAMPLE_NOT_IN_TASK", "Sample not in task: " + in.sampleId());
        }

        Object schemaRef = task.get("schema_ref");
        SchemaCheck check = labelValidator.validateLabel(in.labelValue(),
                schemaRef == null ? null : schemaRef.toString(), tenant);
        if (!check.valid()) {
            return UnitOutput.failure("SCHEMA_VIOLATION", "Label violates schema: " + check.error());
        }

        try {
            annotationStore.storeAnnotation(in.taskRef(), in.sampleId(), in.labelValue(),
                    in.annotatorRef().toString(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.WRITE_FAILURE) {
                return UnitOutput.failure("STORAGE_FAILURE", "Failed to store annotation: " + e.getMessage());
            }
            throw e;
        }

        return UnitOutput.success(new LabelRecordResult(UUID.randomUUID(), Instant.now()));
    }
}
