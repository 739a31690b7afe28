package com.aiverse.fabric.units.quality;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.quality.ColumnStatistics;
import com.aiverse.fabric.contracts.quality.ProfileInput;
import com.aiverse.fabric.contracts.quality.ProfileResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DatasetReader;
import com.aiverse.fabric.unit.port.ProfileEngine;
import com.aiverse.fabric.unit.port.ProfileEngine.ProfileOutput;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes column statistics and quality scores for a dataset. A profile from a too-small sample is
 * returned with {@code low_confidence} set; a timeout yields no partial profile.
 */
@FabricUnit(id = "DataProfiler", capabilityType = "data-profiling",
        description = "Profiles column statistics and quality metrics",
        computeClass = "cpu-medium", memoryRequirements = "medium", ioPattern = "read-analyze",
        tags = {"profiling", "quality", "stateless"})
public final class DataProfiler extends TypedExecutionUnit<DataProfiler.Input, ProfileResult> {

    public record Input(@JsonProperty("profile_input") ProfileInput profileInput) {
        public Input {
            Objects.requireNonNull(profileInput, "profile_input");
        }
    }

    private final DatasetReader datasetReader;
    private final ProfileEngine profileEngine;

    public DataProfiler(DatasetReader datasetReader, ProfileEngine profileEngine) {
        super(Input.class);
        this.datasetReader = Objects.requireNonNull(datasetReader, "datasetReader");
        this.profileEngine = Objects.requireNonNull(profileEngine, "profileEngine");
    }

    @Override
    public UnitOutput<ProfileResult> run(Input input, TenantContext tenant) throws PortException {
        ProfileInput in = input.profileInput();

        byte[] dataset;
        try {
            dataset = datasetReader.readDataset(in.datasetRef(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case READ_FAILURE -> UnitOutput.failure("DATASET_READ_FAILURE", "Failed to read dataset: " + e.getMessage());
                case INVALID, FORMAT -> UnitOutput.failure("INVALID_DATASET", "Invalid dataset: " + e.getMessage());
                default -> throw e;
            };
        }

        ProfileOutput profile;
        try {
            profile = profileEngine.computeProfile(dataset, in.sampleSize(), in.profilingDepth());
        } catch (PortException e) {
            if (e.failure() == PortFailure.TIMEOUT) {
                return UnitOutput.failure("PROFILE_TIMEOUT", "Profiling timed out");
            }
            throw e;
        }

        List<ColumnStatistics> stats = new ArrayList<>(profile.columnStats().size());
        for (Map<String, Object> s : profile.columnStats()) {
            stats.add(new ColumnStatistics(
                    (String) s.get("column_name"),
                    asLong(s.get("null_count")),
                    asLong(s.get("distinct_count")),
                    s.get("min_value"),
                    s.get("max_value"),
                    s.get("mean_value") instanceof Number n ? n.doubleValue() : null));
        }

        ProfileResult result = new ProfileResult(stats, profile.qualityScores(), profile.patterns(), Instant.now());
        return UnitOutput.success(result).withLowConfidence(profile.lowConfidence());
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
