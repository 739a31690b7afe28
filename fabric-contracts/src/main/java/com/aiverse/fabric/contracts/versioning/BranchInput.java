package com.aiverse.fabric.contracts.versioning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record BranchInput(
        @JsonProperty("dataset_ref") String datasetRef,
        @JsonProperty("source_commit_ref") String sourceCommitRef,
        @JsonProperty("branch_name") String branchName) {

    public BranchInput {
        Objects.requireNonNull(datasetRef, "dataset_ref");
        Objects.requireNonNull(sourceCommitRef, "source_commit_ref");
        Objects.requireNonNull(branchName, "branch_name");
    }
}
