package com.aiverse.fabric.ledger;

/**
 * Lifecycle of an intent execution: SUBMITTED, then RUNNING, then one of the terminal states.
 * PARTIAL means some units succeeded and others failed.
 */
public enum ExecutionStatus {
    SUBMITTED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    PARTIAL;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == PARTIAL;
    }

    /** Terminal status for a run with the given unit outcome counts. */
    public static ExecutionStatus fromOutcomes(int succeeded, int failed) {
        if (failed == 0) return SUCCEEDED;
        return succeeded > 0 ? PARTIAL : FAILED;
    }
}
