package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

public interface AggregationEngine {

    /**
     * @param aggregations output column to aggregate expression, e.g. {@code total -> sum(amount)}
     * @throws PortException {@code INVALID} or {@code MEMORY_EXHAUSTED}
     */
    AggregationOutput computeAggregates(byte[] input, List<String> groupByColumns, Map<String, String> aggregations)
            throws PortException;

    record AggregationOutput(byte[] data, long groupsComputed) {
    }
}
