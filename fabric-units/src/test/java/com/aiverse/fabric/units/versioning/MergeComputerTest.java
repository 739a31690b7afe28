package com.aiverse.fabric.units.versioning;

import com.aiverse.fabric.contracts.MergeResult;
import com.aiverse.fabric.contracts.versioning.MergeComputeResult;
import com.aiverse.fabric.contracts.versioning.MergeConflict;
import com.aiverse.fabric.contracts.versioning.MergeInput;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.MergeEngine;
import com.aiverse.fabric.unit.port.MergeEngine.MergeOutcome;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static org.junit.jupiter.api.Assertions.*;

class MergeComputerTest {

    private final TestPorts.Commits commits = new TestPorts.Commits()
            .add("src", "S").add("tgt", "T").add("base", "B");
    private final MergeEngine clean = (s, t, a) -> new MergeOutcome(true, List.of(), Map.of("rows", 3));

    private MergeComputer.Input input(String source, String target, String ancestor) {
        return new MergeComputer.Input(new MergeInput(source, target, ancestor));
    }

    @Test
    void run_cleanMerge() throws Exception {
        UnitOutput<MergeComputeResult> out = new MergeComputer(commits, clean).run(input("src", "tgt", "base"), TENANT);

        assertTrue(out.isSuccess());
        assertEquals(MergeResult.SUCCESS, out.result().result());
        assertEquals(3, out.result().mergedChangeset().get("rows"));
        assertTrue(out.result().conflicts().isEmpty());
    }

    @Test
    void run_conflictsAreAResultNotAnError() throws Exception {
        MergeConflict c = new MergeConflict("rows/7/amount", 10, 12);
        MergeEngine conflicting = (s, t, a) -> new MergeOutcome(false, List.of(c), null);

        UnitOutput<MergeComputeResult> out = new MergeComputer(commits, conflicting)
                .run(input("src", "tgt", "base"), TENANT);

        assertTrue(out.isSuccess());
        assertEquals(MergeResult.CONFLICT, out.result().result());
        assertEquals(List.of(c), out.result().conflicts());
        assertNull(out.result().mergedChangeset());
    }

    @Test
    void run_missingCommits() throws Exception {
        MergeComputer unit = new MergeComputer(commits, clean);

        assertEquals("SOURCE_NOT_FOUND", unit.run(input("x", "tgt", "base"), TENANT).errorCode());
        assertEquals("TARGET_NOT_FOUND", unit.run(input("src", "x", "base"), TENANT).errorCode());
        assertEquals("NO_COMMON_ANCESTOR", unit.run(input("src", "tgt", "x"), TENANT).errorCode());
    }

    @Test
    void run_contentReadFailure() throws Exception {
        commits.contentFailure = PortFailure.READ_FAILURE;

        UnitOutput<MergeComputeResult> out = new MergeComputer(commits, clean).run(input("src", "tgt", "base"), TENANT);

        assertEquals("COMMIT_READ_FAILURE", out.errorCode());
    }
}
