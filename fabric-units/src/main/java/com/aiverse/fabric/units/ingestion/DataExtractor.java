package com.aiverse.fabric.units.ingestion;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.ingestion.DataExtractionInput;
import com.aiverse.fabric.contracts.ingestion.DataExtractionResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DataReader;
import com.aiverse.fabric.unit.port.DataReader.SourceBatch;
import com.aiverse.fabric.unit.port.StagingArea;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/** Reads a bounded slice of a source and stages it in the requested format. */
@FabricUnit(id = "DataExtractor", capabilityType = "data-extraction",
        description = "Extracts a bounded batch from a source into staging",
        computeClass = "cpu-medium", memoryRequirements = "medium", ioPattern = "read-external-write-staging",
        tags = {"extraction", "ingestion", "stateless"})
public final class DataExtractor extends TypedExecutionUnit<DataExtractor.Input, DataExtractionResult> {

    public record Input(@JsonProperty("extraction_input") DataExtractionInput extractionInput) {
        public Input {
            Objects.requireNonNull(extractionInput, "extraction_input");
        }
    }

    private final DataReader dataReader;
    private final StagingArea stagingArea;

    public DataExtractor(DataReader dataReader, StagingArea stagingArea) {
        super(Input.class);
        this.dataReader = Objects.requireNonNull(dataReader, "dataReader");
        this.stagingArea = Objects.requireNonNull(stagingArea, "stagingArea");
    }

    @Override
    public UnitOutput<DataExtractionResult> run(Input input, TenantContext tenant) throws PortException {
        DataExtractionInput in = input.extractionInput();

        SourceBatch batch;
        try {
            batch = dataReader.readData(in.sourceConnectionRef(), in.sourceQueryOrPath(),
                    in.extractionOffset(), in.extractionLimit(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case READ_FAILURE -> UnitOutput.failure("SOURCE_READ_FAILURE", "Failed to read from source: " + e.getMessage());
                case FORMAT -> UnitOutput.failure("FORMAT_ERROR", "Data format error: " + e.getMessage());
                default -> throw e;
            };
        }

        long bytesWritten;
        try {
            bytesWritten = stagingArea.write(in.targetStagingRef(), batch.data(), in.outputFormat(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case WRITE_FAILURE -> UnitOutput.failure("TARGET_WRITE_FAILURE", "Failed to write to staging: " + e.getMessage());
                case QUOTA_EXCEEDED -> UnitOutput.failure("QUOTA_EXCEEDED", "Storage quota exceeded");
                default -> throw e;
            };
        }

        return UnitOutput.success(new DataExtractionResult(bytesWritten, batch.rowCount(), in.targetStagingRef(),
                batch.watermark(), Instant.now()));
    }
}
