package com.aiverse.fabric.units.feature;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.feature.FeatureStoreWriteInput;
import com.aiverse.fabric.contracts.feature.FeatureStoreWriteResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.FeatureStoreClient;
import com.aiverse.fabric.unit.port.FeatureStoreClient.FeatureStoreWrite;
import com.aiverse.fabric.unit.port.StagingArea;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/** Materializes staged feature values into the online or offline store. */
@FabricUnit(id = "FeatureStoreWriter", capabilityType = "feature-storage",
        description = "Writes computed features into a feature store",
        computeClass = "cpu-medium", memoryRequirements = "medium", ioPattern = "read-staging-write-store",
        tags = {"feature", "store", "stateless"})
public final class FeatureStoreWriter extends TypedExecutionUnit<FeatureStoreWriter.Input, FeatureStoreWriteResult> {

    public static final long MIN_TTL_SECONDS = 60;
    public static final long MAX_TTL_SECONDS = 31_536_000;

    public record Input(@JsonProperty("write_input") FeatureStoreWriteInput writeInput) {
        public Input {
            Objects.requireNonNull(writeInput, "write_input");
        }
    }

    private final StagingArea stagingArea;
    private final FeatureStoreClient featureStore;

    public FeatureStoreWriter(StagingArea stagingArea, FeatureStoreClient featureStore) {
        super(Input.class);
        this.stagingArea = Objects.requireNonNull(stagingArea, "stagingArea");
        this.featureStore = Objects.requireNonNull(featureStore, "featureStore");
    }

    @Override
    public UnitOutput<FeatureStoreWriteResult> run(Input input, TenantContext tenant) throws PortException {
        FeatureStoreWriteInput in = input.writeInput();
        if (in.ttlSeconds() < MIN_TTL_SECONDS || in.ttlSeconds() > MAX_TTL_SECONDS) {
            return UnitOutput.failure("TTL_INVALID",
                    "TTL must be between " + MIN_TTL_SECONDS + " and " + MAX_TTL_SECONDS + " seconds");
        }

        byte[] features;
        try {
            features = stagingArea.read(in.stagingRef(), tenant).data();
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("STAGING_READ_FAILURE", "Failed to read from staging: " + e.getMessage());
            }
            throw e;
        }

        FeatureStoreWrite written;
        try {
            written = featureStore.writeFeatures(features, in.featureSetRef(), in.storeType(), in.ttlSeconds(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case WRITE_FAILURE -> UnitOutput.failure("STORE_WRITE_FAILURE",
                        "Failed to write to feature store: " + e.getMessage());
                case UNAVAILABLE -> UnitOutput.failure("STORE_UNAVAILABLE", "Feature store is unavailable");
                default -> throw e;
            };
        }

        return UnitOutput.success(new FeatureStoreWriteResult(written.entitiesWritten(), written.storeLocation(),
                Instant.now()));
    }
}
