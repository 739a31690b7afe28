package com.aiverse.fabric.units.versioning;

import com.aiverse.fabric.contracts.versioning.CommitInput;
import com.aiverse.fabric.contracts.versioning.CommitResult;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.units.Digests;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static com.aiverse.fabric.units.TestPorts.bytes;
import static org.junit.jupiter.api.Assertions.*;

class DataCommitterTest {

    private final TestPorts.Datasets datasets = new TestPorts.Datasets();
    private final TestPorts.Commits commits = new TestPorts.Commits();
    private final UUID author = UUID.randomUUID();

    private DataCommitter.Input input(String parent) {
        return new DataCommitter.Input(new CommitInput("ds/orders", parent, "nightly load", author));
    }

    @Test
    void run_commitsContentHashAndChangeset() throws Exception {
        datasets.content.put("ds/orders", bytes("v1"));
        datasets.changeset.put("added", 10);
        datasets.changeset.put("removed", 2);

        UnitOutput<CommitResult> out = new DataCommitter(datasets, commits).run(input(null), TENANT);

        assertTrue(out.isSuccess());
        assertEquals(Digests.sha256Hex(bytes("v1")), commits.lastHash);
        assertEquals(author.toString(), commits.lastAuthor);
        assertEquals(10, out.result().changesetSummary().get("added"));
        assertTrue(commits.commits.containsKey(out.result().commitId()));
    }

    @Test
    void run_unknownParentIsRejected() throws Exception {
        UnitOutput<CommitResult> out = new DataCommitter(datasets, commits).run(input("c-missing"), TENANT);

        assertEquals("PARENT_NOT_FOUND", out.errorCode());
        assertEquals("Parent commit not found: c-missing", out.errorMessage());
    }

    @Test
    void run_knownParentIsAccepted() throws Exception {
        commits.add("c-0", "v0");

        assertTrue(new DataCommitter(datasets, commits).run(input("c-0"), TENANT).isSuccess());
    }

    @Test
    void run_mapsReadAndStorageFailures() throws Exception {
        datasets.failure = PortFailure.READ_FAILURE;
        assertEquals("DATASET_READ_FAILURE", new DataCommitter(datasets, commits).run(input(null), TENANT).errorCode());

        datasets.failure = null;
        commits.createFailure = PortFailure.WRITE_FAILURE;
        assertEquals("COMMIT_STORAGE_FAILURE", new DataCommitter(datasets, commits).run(input(null), TENANT).errorCode());
    }
}
