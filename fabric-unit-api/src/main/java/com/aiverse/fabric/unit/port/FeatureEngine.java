package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.unit.PortException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface FeatureEngine {

    /**
     * Computes feature values for entities within {@code [timeStart, timeEnd)}.
     *
     * @throws PortException {@code COMPUTATION} or {@code KEY_MISMATCH} (an entity key column is missing)
     */
    FeatureOutput computeFeatures(byte[] source, Map<String, Object> definition, List<String> entityKeyColumns,
                                  Instant timeStart, Instant timeEnd) throws PortException;

    record FeatureOutput(byte[] data, long entitiesComputed, long featureValuesCount) {
    }
}
