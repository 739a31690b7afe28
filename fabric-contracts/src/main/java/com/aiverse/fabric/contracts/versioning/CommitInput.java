package com.aiverse.fabric.contracts.versioning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/** Snapshot a dataset. A null {@code parentCommitRef} creates a root commit. */
public record CommitInput(
        @JsonProperty("dataset_ref") String datasetRef,
        @JsonProperty("parent_commit_ref") String parentCommitRef,
        @JsonProperty("commit_message") String commitMessage,
        @JsonProperty("author_ref") UUID authorRef) {

    public CommitInput {
        Objects.requireNonNull(datasetRef, "dataset_ref");
        Objects.requireNonNull(authorRef, "author_ref");
    }
}
