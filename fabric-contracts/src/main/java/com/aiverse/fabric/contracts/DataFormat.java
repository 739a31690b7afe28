package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Storage format of a dataset or staging area. */
public enum DataFormat {
    @JsonProperty("parquet") PARQUET("parquet"),
    @JsonProperty("delta") DELTA("delta"),
    @JsonProperty("iceberg") ICEBERG("iceberg"),
    @JsonProperty("csv") CSV("csv"),
    @JsonProperty("json") JSON("json"),
    @JsonProperty("avro") AVRO("avro");

    private final String value;

    DataFormat(String value) {
        this.value = value;
    }

    /** Wire value (lowercase). */
    public String value() {
        return value;
    }
}
