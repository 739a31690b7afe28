package com.aiverse.fabric.contracts.transform;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.JoinType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record JoinInput(
        @JsonProperty("left_input_ref") String leftInputRef,
        @JsonProperty("right_input_ref") String rightInputRef,
        @JsonProperty("join_keys") List<String> joinKeys,
        @JsonProperty("join_type") JoinType joinType,
        @JsonProperty("output_staging_ref") String outputStagingRef) {

    public JoinInput {
        Objects.requireNonNull(leftInputRef, "left_input_ref");
        Objects.requireNonNull(rightInputRef, "right_input_ref");
        Objects.requireNonNull(joinType, "join_type");
        Objects.requireNonNull(outputStagingRef, "output_staging_ref");
        joinKeys = Copies.list(joinKeys);
    }
}
