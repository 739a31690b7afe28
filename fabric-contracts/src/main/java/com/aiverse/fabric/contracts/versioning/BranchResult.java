package com.aiverse.fabric.contracts.versioning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record BranchResult(
        @JsonProperty("branch_id") UUID branchId,
        @JsonProperty("head_commit_ref") String headCommitRef,
        @JsonProperty("created_at") Instant createdAt) {
}
