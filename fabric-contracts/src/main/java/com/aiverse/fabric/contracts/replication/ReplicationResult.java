package com.aiverse.fabric.contracts.replication;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ReplicationResult(
        @JsonProperty("bytes_replicated") long bytesReplicated,
        @JsonProperty("target_confirmed") String targetConfirmed,
        @JsonProperty("checksum_match") boolean checksumMatch,
        @JsonProperty("replicated_at") Instant replicatedAt) {
}
