package com.aiverse.fabric.units.transform;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.FabricJson;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.transform.TransformInput;
import com.aiverse.fabric.contracts.transform.TransformResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.StagingArea;
import com.aiverse.fabric.unit.port.TransformEngine;
import com.aiverse.fabric.unit.port.TransformEngine.TransformOutput;
import com.aiverse.fabric.units.Digests;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a declarative transformation to staged data. The result carries a 16-hex-character fingerprint of
 * the definition and parameters so lineage can tell transformations apart.
 */
@FabricUnit(id = "TransformExecutor", capabilityType = "data-transformation",
        description = "Applies a transformation definition to staged data",
        computeClass = "cpu-large", memoryRequirements = "high", ioPattern = "read-process-write",
        tags = {"transform", "processing", "stateless"})
public final class TransformExecutor extends TypedExecutionUnit<TransformExecutor.Input, TransformResult> {

    public record Input(@JsonProperty("transform_input") TransformInput transformInput) {
        public Input {
            Objects.requireNonNull(transformInput, "transform_input");
        }
    }

    private final StagingArea stagingArea;
    private final TransformEngine transformEngine;

    public TransformExecutor(StagingArea stagingArea, TransformEngine transformEngine) {
        super(Input.class);
        this.stagingArea = Objects.requireNonNull(stagingArea, "stagingArea");
        this.transformEngine = Objects.requireNonNull(transformEngine, "transformEngine");
    }

    @Override
    public UnitOutput<TransformResult> run(Input input, TenantContext tenant) throws PortException {
        TransformInput in = input.transformInput();

        byte[] data;
        try {
            data = stagingArea.read(in.inputDataRef(), tenant).data();
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("INPUT_READ_FAILURE", "Failed to read input: " + e.getMessage());
            }
            throw e;
        }

        TransformOutput output;
        try {
            output = transformEngine.applyTransform(data, in.transformationDefinition(), in.parameters());
        } catch (PortException e) {
            return switch (e.failure()) {
                case COMPUTATION, INVALID -> UnitOutput.failure("TRANSFORM_ERROR", "Transformation failed: " + e.getMessage());
                case RESOURCE_EXHAUSTED, MEMORY_EXHAUSTED ->
                        UnitOutput.failure("RESOURCE_EXHAUSTED", "Resource limits exceeded, terminated");
                default -> throw e;
            };
        }

        try {
            stagingArea.write(in.outputStagingRef(), output.data(), null, tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.WRITE_FAILURE || e.failure() == PortFailure.QUOTA_EXCEEDED) {
                return UnitOutput.failure("OUTPUT_WRITE_FAILURE", "Failed to write output: " + e.getMessage());
            }
            throw e;
        }

        return UnitOutput.success(new TransformResult(output.rowsIn(), output.rowsOut(), in.outputStagingRef(),
                transformationHash(in.transformationDefinition(), in.parameters()), Instant.now()));
    }

    /** First 16 hex characters of SHA-256 over the key-sorted JSON of definition then parameters. */
    public static String transformationHash(Map<String, Object> definition, Map<String, Object> parameters) {
        String hex = Digests.sha256Hex(FabricJson.toJson(definition), FabricJson.toJson(parameters));
        return hex.substring(0, 16);
    }
}
