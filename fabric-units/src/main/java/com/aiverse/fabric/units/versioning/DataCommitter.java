package com.aiverse.fabric.units.versioning;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.versioning.CommitInput;
import com.aiverse.fabric.contracts.versioning.CommitResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.CommitStore;
import com.aiverse.fabric.unit.port.DatasetReader;
import com.aiverse.fabric.unit.port.DatasetReader.DatasetState;
import com.aiverse.fabric.units.Digests;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/** Creates an immutable commit for the current dataset state, addressed by the SHA-256 of its content. */
@FabricUnit(id = "DataCommitter", capabilityType = "data-versioning",
        description = "Commits the current state of a dataset",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "read-commit",
        tags = {"commit", "versioning", "stateless"})
public final class DataCommitter extends TypedExecutionUnit<DataCommitter.Input, CommitResult> {

    public record Input(@JsonProperty("commit_input") CommitInput commitInput) {
        public Input {
            Objects.requireNonNull(commitInput, "commit_input");
        }
    }

    private final DatasetReader datasetReader;
    private final CommitStore commitStore;

    public DataCommitter(DatasetReader datasetReader, CommitStore commitStore) {
        super(Input.class);
        this.datasetReader = Objects.requireNonNull(datasetReader, "datasetReader");
        this.commitStore = Objects.requireNonNull(commitStore, "commitStore");
    }

    @Override
    public UnitOutput<CommitResult> run(Input input, TenantContext tenant) throws PortException {
        CommitInput in = input.commitInput();

        String parent = in.parentCommitRef();
        if (parent != null && !parent.isEmpty() && commitStore.getCommit(parent, tenant) == null) {
            return UnitOutput.failure("PARENT_NOT_FOUND", "Parent commit not found: " + parent);
        }

        DatasetState state;
        try {
            state = datasetReader.readDatasetState(in.datasetRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("DATASET_READ_FAILURE", "Failed to read dataset state: " + e.getMessage());
            }
            throw e;
        }

        String contentHash = Digests.sha256Hex(state.content());

        String commitId;
        try {
            commitId = commitStore.createCommit(in.datasetRef(), parent, contentHash, state.changeset(),
                    in.commitMessage(), in.authorRef().toString(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.WRITE_FAILURE) {
                return UnitOutput.failure("COMMIT_STORAGE_FAILURE", "Failed to store commit: " + e.getMessage());
            }
            throw e;
        }

        return UnitOutput.success(new CommitResult(commitId, state.changeset(), Instant.now()));
    }
}
