package com.aiverse.fabric.units.transform;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.transform.JoinInput;
import com.aiverse.fabric.contracts.transform.JoinResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.JoinEngine;
import com.aiverse.fabric.unit.port.JoinEngine.JoinOutput;
import com.aiverse.fabric.unit.port.StagingArea;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

@FabricUnit(id = "DataJoiner", capabilityType = "data-joining",
        description = "Joins two staged inputs on key columns",
        computeClass = "cpu-large", memoryRequirements = "high", ioPattern = "read-multi-write",
        tags = {"join", "merge", "stateless"})
public final class DataJoiner extends TypedExecutionUnit<DataJoiner.Input, JoinResult> {

    public record Input(@JsonProperty("join_input") JoinInput joinInput) {
        public Input {
            Objects.requireNonNull(joinInput, "join_input");
        }
    }

    private final StagingArea stagingArea;
    private final JoinEngine joinEngine;

    public DataJoiner(StagingArea stagingArea, JoinEngine joinEngine) {
        super(Input.class);
        this.stagingArea = Objects.requireNonNull(stagingArea, "stagingArea");
        this.joinEngine = Objects.requireNonNull(joinEngine, "joinEngine");
    }

    @Override
    public UnitOutput<JoinResult> run(Input input, TenantContext tenant) throws PortException {
        JoinInput in = input.joinInput();

        byte[] left;
        try {
            left = stagingArea.read(in.leftInputRef(), tenant).data();
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("LEFT_INPUT_READ_FAILURE", "Failed to read left input: " + e.getMessage());
            }
            throw e;
        }
        byte[] right;
        try {
            right = stagingArea.read(in.rightInputRef(), tenant).data();
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("RIGHT_INPUT_READ_FAILURE", "Failed to read right input: " + e.getMessage());
            }
            throw e;
        }

        JoinOutput output;
        try {
            output = joinEngine.executeJoin(left, right, in.joinKeys(), in.joinType());
        } catch (PortException e) {
            return switch (e.failure()) {
                case KEY_MISMATCH -> UnitOutput.failure("KEY_MISMATCH", "Join key mismatch: " + e.getMessage());
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

        return UnitOutput.success(new JoinResult(output.rowsOutput(), output.matchedCount(), output.unmatchedLeft(),
                output.unmatchedRight(), in.outputStagingRef(), Instant.now()));
    }
}
