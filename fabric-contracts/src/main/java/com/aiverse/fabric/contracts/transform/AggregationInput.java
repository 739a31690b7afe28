package com.aiverse.fabric.contracts.transform;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Group-by aggregation. {@code aggregations} maps output column to aggregate expression. */
public record AggregationInput(
        @JsonProperty("input_data_ref") String inputDataRef,
        @JsonProperty("group_by_columns") List<String> groupByColumns,
        @JsonProperty("aggregations") Map<String, String> aggregations,
        @JsonProperty("output_staging_ref") String outputStagingRef) {

    public AggregationInput {
        Objects.requireNonNull(inputDataRef, "input_data_ref");
        Objects.requireNonNull(outputStagingRef, "output_staging_ref");
        groupByColumns = Copies.list(groupByColumns);
        aggregations = Copies.map(aggregations);
    }
}
