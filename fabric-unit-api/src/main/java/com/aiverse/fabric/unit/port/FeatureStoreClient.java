package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.StoreType;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Online and offline feature store. Both operations fail with {@code UNAVAILABLE} when the store is down;
 * writes otherwise fail with {@code WRITE_FAILURE} and reads with {@code READ_FAILURE}.
 */
public interface FeatureStoreClient {

    FeatureStoreWrite writeFeatures(byte[] featureData, String featureSetRef, StoreType storeType, long ttlSeconds,
                                    TenantContext tenant) throws PortException;

    /**
     * @param pointInTime null for the latest values
     */
    List<FeatureRecord> readFeatures(String featureSetRef, List<Map<String, Object>> entityKeys,
                                     List<String> featureNames, Instant pointInTime, StoreType storeType,
                                     TenantContext tenant) throws PortException;

    record FeatureStoreWrite(long entitiesWritten, String storeLocation) {
    }

    /** Null {@code isMissing} and {@code stalenessSeconds} mean not reported. */
    record FeatureRecord(Map<String, Object> entityKey, String featureName, Object value,
                         Boolean isMissing, Long stalenessSeconds) {
        public FeatureRecord {
            entityKey = Copies.map(entityKey);
        }
    }
}
