package com.aiverse.fabric.units.ingestion;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.ingestion.DataWriteInput;
import com.aiverse.fabric.contracts.ingestion.DataWriteResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DatasetWriter;
import com.aiverse.fabric.unit.port.DatasetWriter.DatasetWrite;
import com.aiverse.fabric.unit.port.StagingArea;
import com.aiverse.fabric.unit.port.StagingArea.StagedData;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/** Persists staged data into a target dataset. */
@FabricUnit(id = "DataWriter", capabilityType = "data-writing",
        description = "Writes staged data into a dataset",
        computeClass = "cpu-medium", memoryRequirements = "medium", ioPattern = "read-staging-write-dataset",
        tags = {"write", "persistence", "stateless"})
public final class DataWriter extends TypedExecutionUnit<DataWriter.Input, DataWriteResult> {

    public record Input(@JsonProperty("write_input") DataWriteInput writeInput) {
        public Input {
            Objects.requireNonNull(writeInput, "write_input");
        }
    }

    private final StagingArea stagingArea;
    private final DatasetWriter datasetWriter;

    public DataWriter(StagingArea stagingArea, DatasetWriter datasetWriter) {
        super(Input.class);
        this.stagingArea = Objects.requireNonNull(stagingArea, "stagingArea");
        this.datasetWriter = Objects.requireNonNull(datasetWriter, "datasetWriter");
    }

    @Override
    public UnitOutput<DataWriteResult> run(Input input, TenantContext tenant) throws PortException {
        DataWriteInput in = input.writeInput();

        StagedData staged;
        try {
            staged = stagingArea.read(in.stagingRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("STAGING_READ_FAILURE", "Failed to read from staging: " + e.getMessage());
            }
            throw e;
        }

        DatasetWrite written;
        try {
            written = datasetWriter.writeDataset(in.targetDatasetRef(), staged.data(), in.writeMode(),
                    in.partitionSpec(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case WRITE_FAILURE -> UnitOutput.failure("TARGET_WRITE_FAILURE", "Failed to write to dataset: " + e.getMessage());
                case SCHEMA_MISMATCH -> UnitOutput.failure("SCHEMA_MISMATCH", "Schema mismatch: " + e.getMessage());
                case QUOTA_EXCEEDED -> UnitOutput.failure("QUOTA_EXCEEDED", "Storage quota exceeded");
                default -> throw e;
            };
        }

        return UnitOutput.success(new DataWriteResult(written.bytesWritten(), written.rowsWritten(),
                written.location(), Instant.now()));
    }
}
