package com.aiverse.fabric.contracts.versioning;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.MergeResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Three-way merge outcome. {@code mergedChangeset} is null when the merge conflicts. */
public record MergeComputeResult(
        @JsonProperty("result") MergeResult result,
        @JsonProperty("conflicts") List<MergeConflict> conflicts,
        @JsonProperty("merged_changeset") Map<String, Object> mergedChangeset,
        @JsonProperty("computed_at") Instant computedAt) {

    public MergeComputeResult {
        conflicts = Copies.list(conflicts);
        mergedChangeset = mergedChangeset != null ? Copies.map(mergedChangeset) : null;
    }
}
