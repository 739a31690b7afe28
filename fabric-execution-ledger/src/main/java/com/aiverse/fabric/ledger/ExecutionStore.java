package com.aiverse.fabric.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Store for intent executions and their unit records. {@link ExecutionLedger} wraps writes so a store
 * failure never fails an execution.
 */
public interface ExecutionStore {

    void executionSubmitted(ExecutionRecord record);

    void statusChanged(String executionId, ExecutionStatus status, Instant at, String errorMessage);

    void unitRecorded(UnitRecord record);

    /** Execution with its units, or empty if unknown. */
    Optional<ExecutionRecord> find(String executionId);

    /** Most recent executions of the tenant, newest first, without unit records. */
    List<ExecutionRecord> listByTenant(String tenantId, int limit);
}
