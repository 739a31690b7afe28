package com.aiverse.fabric.units.transform;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.transform.AggregationInput;
import com.aiverse.fabric.contracts.transform.AggregationResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.AggregationEngine;
import com.aiverse.fabric.unit.port.AggregationEngine.AggregationOutput;
import com.aiverse.fabric.unit.port.StagingArea;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

@FabricUnit(id = "AggregationComputer", capabilityType = "data-aggregation",
        description = "Computes group-by aggregates over staged data",
        computeClass = "cpu-medium", memoryRequirements = "high", ioPattern = "read-aggregate-write",
        tags = {"aggregation", "analytics", "stateless"})
public final class AggregationComputer extends TypedExecutionUnit<AggregationComputer.Input, AggregationResult> {

    public record Input(@JsonProperty("aggregation_input") AggregationInput aggregationInput) {
        public Input {
            Objects.requireNonNull(aggregationInput, "aggregation_input");
        }
    }

    private final StagingArea stagingArea;
    private final AggregationEngine aggregationEngine;

    public AggregationComputer(StagingArea stagingArea, AggregationEngine aggregationEngine) {
        super(Input.class);
        this.stagingArea = Objects.requireNonNull(stagingArea, "stagingArea");
        this.aggregationEngine = Objects.requireNonNull(aggregationEngine, "aggregationEngine");
    }

    @Override
    public UnitOutput<AggregationResult> run(Input input, TenantContext tenant) throws PortException {
        AggregationInput in = input.aggregationInput();

        byte[] data;
        try {
            data = stagingArea.read(in.inputDataRef(), tenant).data();
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("INPUT_READ_FAILURE", "Failed to read input: " + e.getMessage());
            }
            throw e;
        }

        AggregationOutput output;
        try {
            output = aggregationEngine.computeAggregates(data, in.groupByColumns(), in.aggregations());
        } catch (PortException e) {
            return switch (e.failure()) {
                case INVALID -> UnitOutput.failure("INVALID_AGGREGATION", "Invalid aggregation: " + e.getMessage());
                case MEMORY_EXHAUSTED, RESOURCE_EXHAUSTED ->
                        UnitOutput.failure("MEMORY_EXHAUSTED", "Memory limits exceeded, terminated");
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

        return UnitOutput.success(new AggregationResult(output.groupsComputed(), in.outputStagingRef(), Instant.now()));
    }
}
