package com.aiverse.fabric.units.feature;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.feature.FeatureComputeInput;
import com.aiverse.fabric.contracts.feature.FeatureComputeResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.FeatureDefinitionResolver;
import com.aiverse.fabric.unit.port.FeatureEngine;
import com.aiverse.fabric.unit.port.FeatureEngine.FeatureOutput;
import com.aiverse.fabric.unit.port.StagingArea;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/** Computes feature values for a time window from staged source data. */
@FabricUnit(id = "FeatureComputer", capabilityType = "feature-computation",
        description = "Computes features for entities over a time window",
        computeClass = "cpu-large", memoryRequirements = "high", ioPattern = "read-compute-write",
        tags = {"feature", "ml", "stateless"})
public final class FeatureComputer extends TypedExecutionUnit<FeatureComputer.Input, FeatureComputeResult> {

    public record Input(@JsonProperty("compute_input") FeatureComputeInput computeInput) {
        public Input {
            Objects.requireNonNull(computeInput, "compute_input");
        }
    }

    private final FeatureDefinitionResolver definitionResolver;
    private final StagingArea stagingArea;
    private final FeatureEngine featureEngine;

    public FeatureComputer(FeatureDefinitionResolver definitionResolver, StagingArea stagingArea,
                           FeatureEngine featureEngine) {
        super(Input.class);
        this.definitionResolver = Objects.requireNonNull(definitionResolver, "definitionResolver");
        this.stagingArea = Objects.requireNonNull(stagingArea, "stagingArea");
        this.featureEngine = Objects.requireNonNull(featureEngine, "featureEngine");
    }

    @Override
    public UnitOutput<FeatureComputeResult> run(Input input, TenantContext tenant) throws PortException {
        FeatureComputeInput in = input.computeInput();

        Map<String, Object> definition;
        try {
            definition = definitionResolver.resolve(in.featureDefinitionRef(), tenant);
        } catch (PortException e) {
            if (e.failure() != PortFailure.NOT_FOUND) throw e;
            definition = null;
        }
        if (definition == null) {
            return UnitOutput.failure("DEFINITION_NOT_FOUND", "Feature definition not found");
        }

        byte[] source;
        try {
            source = stagingArea.read(in.sourceDataRef(), tenant).data();
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("SOURCE_READ_FAILURE", "Failed to read source: " + e.getMessage());
            }
            throw e;
        }

        FeatureOutput output;
        try {
            output = featureEngine.computeFeatures(source, definition, in.entityKeyColumns(),
                    in.timeStart(), in.timeEnd());
        } catch (PortException e) {
            return switch (e.failure()) {
                case COMPUTATION -> UnitOutput.failure("COMPUTATION_ERROR", "Feature computation failed: " + e.getMessage());
                case KEY_MISMATCH -> UnitOutput.failure("ENTITY_KEY_MISSING", "Entity key column missing: " + e.getMessage());
                default -> throw e;
            };
        }

        try {
            stagingArea.write(in.outputStagingRef(), output.data(), null, tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.WRITE_FAILURE || e.failure() == PortFailure.QUOTA_EXCEEDED) {
                return UnitOutput.failure("OUTPUT_WRITE_FAILURE", "Failed to write features: " + e.getMessage());
            }
            throw e;
        }

        return UnitOutput.success(new FeatureComputeResult(output.entitiesComputed(), output.featureValuesCount(),
                in.outputStagingRef(), Instant.now()));
    }
}
