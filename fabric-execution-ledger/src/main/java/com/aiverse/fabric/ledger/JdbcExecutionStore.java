package com.aiverse.fabric.ledger;

import com.aiverse.fabric.config.FabricConfig;
import com.aiverse.fabric.ledger.schema.LedgerSchemaBootstrapper;
import com.aiverse.fabric.ledger.store.ExecutionWriter;
import com.aiverse.fabric.ledger.store.LedgerConnectionProvider;
import com.aiverse.fabric.ledger.store.UnitRecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL execution store over tables fabric_execution and fabric_execution_unit.
 * Call {@link #ensureSchema()} once at bootstrap. Failures surface as {@link LedgerStoreException}.
 */
public final class JdbcExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionStore.class);

    private final LedgerConnectionProvider connections;
    private final LedgerSchemaBootstrapper schema = new LedgerSchemaBootstrapper();
    private final ExecutionWriter executionWriter = new ExecutionWriter();
    private final UnitRecordWriter unitWriter = new UnitRecordWriter();

    public JdbcExecutionStore(FabricConfig config) {
        this.connections = new LedgerConnectionProvider(config);
    }

    public void ensureSchema() {
        log.info("Ledger schema: bootstrapping against {}", connections.jdbcUrl());
        schema.ensureSchema(connections::getConnection);
    }

    @Override
    public void executionSubmitted(ExecutionRecord record) {
        try (Connection c = connections.getConnection()) {
            executionWriter.insert(c, record);
        } catch (SQLException e) {
            throw new LedgerStoreException("Insert execution failed: " + record.executionId(), e);
        }
    }

    @Override
    public void statusChanged(String executionId, ExecutionStatus status, Instant at, String errorMessage) {
        try (Connection c = connections.getConnection()) {
            if (!executionWriter.updateStatus(c, executionId, status, at, errorMessage)) {
                throw new LedgerStoreException("Unknown execution: " + executionId, null);
            }
        } catch (SQLException e) {
            throw new LedgerStoreException("Update execution failed: " + executionId, e);
        }
    }

    @Override
    public void unitRecorded(UnitRecord record) {
        try (Connection c = connections.getConnection()) {
            unitWriter.insert(c, record);
        } catch (SQLException e) {
            throw new LedgerStoreException("Insert unit record failed: " + record.executionId() + "/" + record.unitId(), e);
        }
    }

    @Override
    public Optional<ExecutionRecord> find(String executionId) {
        if (executionId == null || executionId.isBlank()) return Optional.empty();
        try (Connection c = connections.getConnection()) {
            Optional<ExecutionRecord> found = executionWriter.select(c, executionId);
            if (found.isEmpty()) return found;
            return Optional.of(found.get().withUnits(unitWriter.selectByExecution(c, executionId)));
        } catch (SQLException e) {
            throw new LedgerStoreException("Select execution failed: " + executionId, e);
        }
    }

    @Override
    public List<ExecutionRecord> listByTenant(String tenantId, int limit) {
        try (Connection c = connections.getConnection()) {
            return executionWriter.selectByTenant(c, tenantId, limit);
        } catch (SQLException e) {
            throw new LedgerStoreException("Select executions failed for tenant " + tenantId, e);
        }
    }
}
