package com.aiverse.fabric.units.versioning;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.MergeResult;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.versioning.MergeComputeResult;
import com.aiverse.fabric.contracts.versioning.MergeInput;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.CommitStore;
import com.aiverse.fabric.unit.port.MergeEngine;
import com.aiverse.fabric.unit.port.MergeEngine.MergeOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Computes a three-way merge of two commits against their common ancestor. Only computes: the merged
 * changeset is committed separately.
 */
@FabricUnit(id = "MergeComputer", capabilityType = "data-merging",
        description = "Computes a three-way merge between commits",
        computeClass = "cpu-medium", memoryRequirements = "medium", ioPattern = "read-multi-compute",
        tags = {"merge", "versioning", "stateless"})
public final class MergeComputer extends TypedExecutionUnit<MergeComputer.Input, MergeComputeResult> {

    public record Input(@JsonProperty("merge_input") MergeInput mergeInput) {
        public Input {
            Objects.requireNonNull(mergeInput, "merge_input");
        }
    }

    private final CommitStore commitStore;
    private final MergeEngine mergeEngine;

    public MergeComputer(CommitStore commitStore, MergeEngine mergeEngine) {
        super(Input.class);
        this.commitStore = Objects.requireNonNull(commitStore, "commitStore");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine");
    }

    @Override
    public UnitOutput<MergeComputeResult> run(Input input, TenantContext tenant) throws PortException {
        MergeInput in = input.mergeInput();

        if (commitStore.getCommit(in.sourceCommitRef(), tenant) == null) {
            return UnitOutput.failure("SOURCE_NOT_FOUND", "Source commit not found: " + in.sourceCommitRef());
        }
        if (commitStore.getCommit(in.targetCommitRef(), tenant) == null) {
            return UnitOutput.failure("TARGET_NOT_FOUND", "Target commit not found: " + in.targetCommitRef());
        }
        if (commitStore.getCommit(in.commonAncestorRef(), tenant) == null) {
            return UnitOutput.failure("NO_COMMON_ANCESTOR", "No common ancestor found for merge");
        }

        byte[] source;
        byte[] target;
        byte[] ancestor;
        try {
            source = commitStore.getCommitContent(in.sourceCommitRef(), tenant);
            target = commitStore.getCommitContent(in.targetCommitRef(), tenant);
            ancestor = commitStore.getCommitContent(in.commonAncestorRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.failure("COMMIT_READ_FAILURE", "Failed to read commit content: " + e.getMessage());
            }
            throw e;
        }

        MergeOutcome outcome = mergeEngine.computeMerge(source, target, ancestor);
        MergeResult result = outcome.success() ? MergeResult.SUCCESS : MergeResult.CONFLICT;
        return UnitOutput.success(new MergeComputeResult(result, outcome.conflicts(), outcome.mergedChangeset(),
                Instant.now()));
    }
}
