package com.aiverse.fabric.contracts.versioning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record MergeInput(
        @JsonProperty("source_commit_ref") String sourceCommitRef,
        @JsonProperty("target_commit_ref") String targetCommitRef,
        @JsonProperty("common_ancestor_ref") String commonAncestorRef) {

    public MergeInput {
        Objects.requireNonNull(sourceCommitRef, "source_commit_ref");
        Objects.requireNonNull(targetCommitRef, "target_commit_ref");
        Objects.requireNonNull(commonAncestorRef, "common_ancestor_ref");
    }
}
