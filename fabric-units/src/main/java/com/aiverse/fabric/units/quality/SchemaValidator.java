package com.aiverse.fabric.units.quality;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.schema.SchemaValidationInput;
import com.aiverse.fabric.contracts.schema.SchemaValidationResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DatasetReader;
import com.aiverse.fabric.unit.port.SchemaResolver;
import com.aiverse.fabric.unit.port.ValidationEngine;
import com.aiverse.fabric.unit.port.ValidationEngine.ValidationOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Validates a dataset against an expected schema. Read and type inference failures are inconclusive;
 * a missing expected schema is not.
 */
@FabricUnit(id = "SchemaValidator", capabilityType = "schema-validation",
        description = "Validates a dataset against an expected schema",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "read-validate",
        tags = {"schema", "validation", "stateless"})
public final class SchemaValidator extends TypedExecutionUnit<SchemaValidator.Input, SchemaValidationResult> {

    public record Input(@JsonProperty("validation_input") SchemaValidationInput validationInput) {
        public Input {
            Objects.requireNonNull(validationInput, "validation_input");
        }
    }

    private final SchemaResolver schemaResolver;
    private final DatasetReader datasetReader;
    private final ValidationEngine validationEngine;

    public SchemaValidator(SchemaResolver schemaResolver, DatasetReader datasetReader,
                           ValidationEngine validationEngine) {
        super(Input.class);
        this.schemaResolver = Objects.requireNonNull(schemaResolver, "schemaResolver");
        this.datasetReader = Objects.requireNonNull(datasetReader, "datasetReader");
        this.validationEngine = Objects.requireNonNull(validationEngine, "validationEngine");
    }

    @Override
    public UnitOutput<SchemaValidationResult> run(Input input, TenantContext tenant) throws PortException {
        SchemaValidationInput in = input.validationInput();

        Map<String, Object> expected;
        try {
            expected = schemaResolver.resolve(in.expectedSchemaRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.UNAVAILABLE || e.failure() == PortFailure.NOT_FOUND) {
                return UnitOutput.failure("SCHEMA_UNAVAILABLE", "Expected schema is unavailable");
            }
            throw e;
        }

        byte[] dataset;
        try {
            dataset = datasetReader.readDataset(in.datasetRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.<SchemaValidationResult>failure("DATASET_READ_FAILURE",
                        "Failed to read dataset: " + e.getMessage()).withInconclusive(true);
            }
            throw e;
        }

        ValidationOutcome outcome;
        try {
            outcome = validationEngine.validateSchema(dataset, expected, in.validationMode());
        } catch (PortException e) {
            if (e.failure() == PortFailure.FORMAT) {
                return UnitOutput.<SchemaValidationResult>failure("TYPE_INFERENCE_FAILURE",
                        "Could not infer types from dataset").withInconclusive(true);
            }
            throw e;
        }

        return UnitOutput.success(new SchemaValidationResult(outcome.valid(), outcome.discrepancies(), Instant.now()));
    }
}
