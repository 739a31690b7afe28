package com.aiverse.fabric.ledger;

import com.aiverse.fabric.config.FabricConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fail-safe facade for the execution ledger. Every call delegates to {@link ExecutionStore}; any exception from
 * the store is caught and logged, never rethrown, so an intent execution never fails because of its ledger.
 */
public final class ExecutionLedger {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

    private final ExecutionStore store;
    private final Clock clock;

    public ExecutionLedger(ExecutionStore store) {
        this(store, Clock.systemUTC());
    }

    public ExecutionLedger(ExecutionStore store, Clock clock) {
        this.store = store != null ? store : new InMemoryExecutionStore();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /** Ledger over the store selected by {@code FABRIC_LEDGER_STORE}; the JDBC store gets its schema bootstrapped here. */
    public static ExecutionLedger create(FabricConfig config) {
        if (config.getLedgerStore() == FabricConfig.LedgerStore.JDBC) {
            JdbcExecutionStore jdbc = new JdbcExecutionStore(config);
            jdbc.ensureSchema();
            log.info("Execution ledger: JDBC store");
            return new ExecutionLedger(jdbc);
        }
        log.info("Execution ledger: in-memory store");
        return new ExecutionLedger(new InMemoryExecutionStore());
    }

    public Instant now() {
        return clock.instant();
    }

    public ExecutionStore getStore() {
        return store;
    }

    public void submitted(ExecutionRecord record) {
        try {
            store.executionSubmitted(record);
        } catch (Throwable t) {
            log.warn("Ledger executionSubmitted failed (executionId={}); execution continues. Error: {}", record.executionId(), t.getMessage(), t);
        }
    }

    public void started(String executionId) {
        statusChanged(executionId, ExecutionStatus.RUNNING, null);
    }

    public void ended(String executionId, ExecutionStatus status, String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        statusChanged(executionId, status, errorMessage);
    }

    private void statusChanged(String executionId, ExecutionStatus status, String errorMessage) {
        try {
            store.statusChanged(executionId, status, now(), errorMessage);
        } catch (Throwable t) {
            log.warn("Ledger statusChanged {} failed (executionId={}); execution continues. Error: {}", status, executionId, t.getMessage(), t);
        }
    }

    public void unitRecorded(UnitRecord record) {
        try {
            store.unitRecorded(record);
        } catch (Throwable t) {
            log.warn("Ledger unitRecorded failed (executionId={}, unit={}); execution continues. Error: {}",
                    record.executionId(), record.unitId(), t.getMessage(), t);
        }
    }

    /** Lookup; a store failure is logged and reads as unknown. */
    public Optional<ExecutionRecord> find(String executionId) {
        try {
            return store.find(executionId);
        } catch (Throwable t) {
            log.warn("Ledger find failed (executionId={}). Error: {}", executionId, t.getMessage(), t);
            return Optional.empty();
        }
    }

    public List<ExecutionRecord> listByTenant(String tenantId, int limit) {
        try {
            return store.listByTenant(tenantId, limit);
        } catch (Throwable t) {
            log.warn("Ledger listByTenant failed (tenant={}). Error: {}", tenantId, t.getMessage(), t);
            return List.of();
        }
    }
}
