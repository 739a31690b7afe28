package com.aiverse.fabric.units.feature;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.feature.FeatureRetrieveInput;
import com.aiverse.fabric.contracts.feature.FeatureRetrieveResult;
import com.aiverse.fabric.contracts.feature.FeatureValue;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.FeatureStoreClient;
import com.aiverse.fabric.unit.port.FeatureStoreClient.FeatureRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Point lookup of feature values. Unknown entities and unmaterialized features come back as values with
 * {@code is_missing} set rather than as errors.
 */
@FabricUnit(id = "FeatureRetriever", capabilityType = "feature-retrieval",
        description = "Reads feature values for entity keys",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "read-store",
        tags = {"feature", "retrieval", "stateless"})
public final class FeatureRetriever extends TypedExecutionUnit<FeatureRetriever.Input, FeatureRetrieveResult> {

    public record Input(@JsonProperty("retrieve_input") FeatureRetrieveInput retrieveInput) {
        public Input {
            Objects.requireNonNull(retrieveInput, "retrieve_input");
        }
    }

    private final FeatureStoreClient featureStore;

    public FeatureRetriever(FeatureStoreClient featureStore) {
        super(Input.class);
        this.featureStore = Objects.requireNonNull(featureStore, "featureStore");
    }

    @Override
    public UnitOutput<FeatureRetrieveResult> run(Input input, TenantContext tenant) throws PortException {
        FeatureRetrieveInput in = input.retrieveInput();

        List<FeatureRecord> records;
        try {
            records = featureStore.readFeatures(in.featureSetRef(), in.entityKeys(), in.featureNames(),
                    in.pointInTime(), in.storePreference(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case READ_FAILURE -> UnitOutput.failure("STORE_READ_FAILURE",
                        "Failed to read from feature store: " + e.getMessage());
                case UNAVAILABLE -> UnitOutput.failure("STORE_UNAVAILABLE", "Feature store is unavailable");
                default -> throw e;
            };
        }

        List<FeatureValue> values = new ArrayList<>(records.size());
        for (FeatureRecord r : records) {
            values.add(new FeatureValue(r.entityKey(), r.featureName(), r.value(),
                    r.isMissing() != null && r.isMissing(),
                    r.stalenessSeconds() != null ? r.stalenessSeconds() : 0L));
        }
        return UnitOutput.success(new FeatureRetrieveResult(values, Instant.now()));
    }
}
