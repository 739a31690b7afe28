package com.aiverse.fabric.units.replication;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.ConsistencyMode;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.replication.ReplicationInput;
import com.aiverse.fabric.contracts.replication.ReplicationResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.StorageClient;
import com.aiverse.fabric.units.Digests;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Copies data between storage locations. Strong consistency re-reads the target and compares SHA-256
 * checksums; eventual consistency trusts the write.
 */
@FabricUnit(id = "DataReplicator", capabilityType = "data-replication",
        description = "Replicates data between storage locations",
        computeClass = "cpu-medium", memoryRequirements = "medium", ioPattern = "read-write-remote",
        tags = {"replication", "locality", "stateless"})
public final class DataReplicator extends TypedExecutionUnit<DataReplicator.Input, ReplicationResult> {

    private static final Logger log = LoggerFactory.getLogger(DataReplicator.class);
    static final String UNVERIFIED = "unverified";

    public record Input(@JsonProperty("replication_input") ReplicationInput replicationInput) {
        public Input {
            Objects.requireNonNull(replicationInput, "replication_input");
        }
    }

    private final StorageClient storageClient;

    public DataReplicator(StorageClient storageClient) {
        super(Input.class);
        this.storageClient = Objects.requireNonNull(storageClient, "storageClient");
    }

    @Override
    public UnitOutput<ReplicationResult> run(Input input, TenantContext tenant) throws PortException {
        ReplicationInput in = input.replicationInput();

        byte[] source;
        try {
            source = storageClient.readLocation(in.sourceLocationRef(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case READ_FAILURE -> UnitOutput.failure("SOURCE_READ_FAILURE", "Failed to read from source: " + e.getMessage());
                case NETWORK -> UnitOutput.failure("NETWORK_FAILURE", "Network error during read: " + e.getMessage());
                default -> throw e;
            };
        }
        String sourceChecksum = Digests.sha256Hex(source);

        String confirmed;
        try {
            confirmed = storageClient.writeLocation(in.targetLocationRef(), source, in.consistencyMode(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case WRITE_FAILURE -> UnitOutput.failure("TARGET_WRITE_FAILURE", "Failed to write to target: " + e.getMessage());
                case NETWORK -> UnitOutput.failure("NETWORK_FAILURE", "Network error during write: " + e.getMessage());
                default -> throw e;
            };
        }

        String targetChecksum;
        if (in.consistencyMode() == ConsistencyMode.STRONG) {
            try {
                targetChecksum = Digests.sha256Hex(storageClient.readLocation(in.targetLocationRef(), tenant));
            } catch (PortException e) {
                log.warn("Could not verify replica at {}: {}", in.targetLocationRef(), e.getMessage());
                targetChecksum = UNVERIFIED;
            }
            if (!UNVERIFIED.equals(targetChecksum) && !sourceChecksum.equals(targetChecksum)) {
                return UnitOutput.failure("CHECKSUM_MISMATCH", "Source and target checksums do not match");
            }
        } else {
            targetChecksum = sourceChecksum;
        }

        return UnitOutput.success(new ReplicationResult(source.length, confirmed,
                sourceChecksum.equals(targetChecksum), Instant.now()));
    }
}
