package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.JoinType;
import com.aiverse.fabric.unit.PortException;

import java.util.List;

public interface JoinEngine {

    /**
     * @throws PortException {@code KEY_MISMATCH} or {@code MEMORY_EXHAUSTED}
     */
    JoinOutput executeJoin(byte[] left, byte[] right, List<String> joinKeys, JoinType joinType) throws PortException;

    record JoinOutput(byte[] data, long rowsOutput, long matchedCount, long unmatchedLeft, long unmatchedRight) {
    }
}
