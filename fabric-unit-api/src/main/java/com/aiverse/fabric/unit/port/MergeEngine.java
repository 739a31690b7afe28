package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.versioning.MergeConflict;
import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

/** Three-way merge of commit contents. */
public interface MergeEngine {

    MergeOutcome computeMerge(byte[] source, byte[] target, byte[] ancestor) throws PortException;

    /** {@code mergedChangeset} is null when the merge has conflicts. */
    record MergeOutcome(boolean success, List<MergeConflict> conflicts, Map<String, Object> mergedChangeset) {
        public MergeOutcome {
            conflicts = Copies.list(conflicts);
            mergedChangeset = mergedChangeset != null ? Copies.map(mergedChangeset) : null;
        }
    }
}
