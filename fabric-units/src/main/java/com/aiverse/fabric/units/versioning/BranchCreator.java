package com.aiverse.fabric.units.versioning;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.versioning.BranchInput;
import com.aiverse.fabric.contracts.versioning.BranchResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.BranchRegistry;
import com.aiverse.fabric.unit.port.CommitStore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@FabricUnit(id = "BranchCreator", capabilityType = "data-branching",
        description = "Creates a named branch at an existing commit",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "write-registry",
        tags = {"branch", "versioning", "stateless"})
public final class BranchCreator extends TypedExecutionUnit<BranchCreator.Input, BranchResult> {

    public record Input(@JsonProperty("branch_input") BranchInput branchInput) {
        public Input {
            Objects.requireNonNull(branchInput, "branch_input");
        }
    }

    private final CommitStore commitStore;
    private final BranchRegistry branchRegistry;

    public BranchCreator(CommitStore commitStore, BranchRegistry branchRegistry) {
        super(Input.class);
        this.commitStore = Objects.requireNonNull(commitStore, "commitStore");
        this.branchRegistry = Objects.requireNonNull(branchRegistry, "branchRegistry");
    }

    @Override
    public UnitOutput<BranchResult> run(Input input, TenantContext tenant) throws PortException {
        BranchInput in = input.branchInput();

        if (commitStore.getCommit(in.sourceCommitRef(), tenant) == null) {
            return UnitOutput.failure("COMMIT_NOT_FOUND", "Source commit not found: " + in.sourceCommitRef());
        }
        if (branchRegistry.branchExists(in.datasetRef(), in.branchName(), tenant)) {
            return UnitOutput.failure("NAME_CONFLICT", "Branch already exists: " + in.branchName());
        }

        try {
            branchRegistry.createBranch(in.datasetRef(), in.branchName(), in.sourceCommitRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.WRITE_FAILURE) {
                return UnitOutput.failure("REGISTRY_WRITE_FAILURE", "Failed to create branch: " + e.getMessage());
            }
            throw e;
        }

        return UnitOutput.success(new BranchResult(UUID.randomUUID(), in.sourceCommitRef(), Instant.now()));
    }
}
