package com.aiverse.fabric.contracts.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-column profile. Min, max and mean are null when not applicable to the column type. */
public record ColumnStatistics(
        @JsonProperty("column_name") String columnName,
        @JsonProperty("null_count") long nullCount,
        @JsonProperty("distinct_count") long distinctCount,
        @JsonProperty("min_value") Object minValue,
        @JsonProperty("max_value") Object maxValue,
        @JsonProperty("mean_value") Double meanValue) {
}
