package com.aiverse.fabric.units.labeling;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.labeling.LabelTaskInput;
import com.aiverse.fabric.contracts.labeling.LabelTaskResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DatasetRegistry;
import com.aiverse.fabric.unit.port.LabelSchemaValidator;
import com.aiverse.fabric.unit.port.LabelTaskRegistry;
import com.aiverse.fabric.unit.port.SampleSelector;
import com.aiverse.fabric.unit.port.SchemaCheck;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Creates a labeling task over the samples of a dataset that match the given criteria. */
@FabricUnit(id = "LabelTaskCreator", capabilityType = "labeling-task",
        description = "Creates labeling tasks from dataset samples",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "write-registry",
        tags = {"labeling", "task", "stateless"})
public final class LabelTaskCreator extends TypedExecutionUnit<LabelTaskCreator.Input, LabelTaskResult> {

    static final String PENDING = "pending";

    public record Input(@JsonProperty("task_input") LabelTaskInput taskInput) {
        public Input {
            Objects.requireNonNull(taskInput, "task_input");
        }
    }

    private final DatasetRegistry datasetRegistry;
    private final LabelSchemaValidator schemaValidator;
    private final SampleSelector sampleSelector;
    private final LabelTaskRegistry taskRegistry;

    public LabelTaskCreator(DatasetRegistry datasetRegistry, LabelSchemaValidator schemaValidator,
                            SampleSelector sampleSelector, LabelTaskRegistry taskRegistry) {
        super(Input.class);
        this.datasetRegistry = Objects.requireNonNull(datasetRegistry, "datasetRegistry");
        this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator");
        this.sampleSelector = Objects.requireNonNull(sampleSelector, "sampleSelector");
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry");
    }

    @Override
    public UnitOutput<LabelTaskResult> run(Input input, TenantContext tenant) throws PortException {
        LabelTaskInput in = input.taskInput();

        if (datasetRegistry.getDataset(in.sourceDatasetRef(), tenant) == null) {
            return UnitOutput.failure("DATASET_NOT_FOUND", "Dataset not found: " + in.sourceDatasetRef());
        }

        SchemaCheck check = schemaValidator.validate(in.labelSchemaRef(), tenant);
        if (!check.valid()) {
            return UnitOutput.failure("SCHEMA_INVALID", "Invalid label schema: " + check.error());
        }

        List<String> samples = sampleSelector.selectSamples(in.sourceDatasetRef(), in.sampleCriteria(), tenant);
        if (samples == null || samples.isEmpty()) {
            return UnitOutput.failure("EMPTY_SELECTION", "Sample criteria matched no records");
        }

        try {
            taskRegistry.createTask(in.sourceDatasetRef(), in.labelSchemaRef(), samples,
                    in.qualityRequirements(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.WRITE_FAILURE) {
                return UnitOutput.failure("REGISTRY_FAILURE", "Failed to create task: " + e.getMessage());
            }
            throw e;
        }

        return UnitOutput.success(new LabelTaskResult(UUID.randomUUID(), samples.size(), PENDING, Instant.now()));
    }
}
