package com.aiverse.fabric.contracts.versioning;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record CommitResult(
        @JsonProperty("commit_id") String commitId,
        @JsonProperty("changeset_summary") Map<String, Integer> changesetSummary,
        @JsonProperty("committed_at") Instant committedAt) {

    public CommitResult {
        changesetSummary = Copies.map(changesetSummary);
    }
}
