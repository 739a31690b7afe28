package com.aiverse.fabric.ledger.store;

import com.aiverse.fabric.ledger.ExecutionRecord;
import com.aiverse.fabric.ledger.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes rows of fabric_execution.
 */
public final class ExecutionWriter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionWriter.class);
    private static final String TABLE = "fabric_execution";
    private static final String COLUMNS = "execution_id, intent_id, tenant_id, intent_type, domain, trace_id, inputs, status, "
            + "submitted_at, started_at, ended_at, error_message";

    public void insert(Connection c, ExecutionRecord r) throws SQLException {
        String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, LedgerSqlUtils.toUuid(r.executionId()));
            ps.setObject(2, LedgerSqlUtils.toUuid(r.intentId()));
            ps.setString(3, LedgerSqlUtils.toName(r.tenantId(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setString(4, LedgerSqlUtils.toName(r.intentType(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setString(5, LedgerSqlUtils.toName(r.domain(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setString(6, LedgerSqlUtils.toName(r.traceId(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setObject(7, LedgerSqlUtils.toJsonb(r.inputs()));
            ps.setString(8, r.status().name());
            ps.setTimestamp(9, LedgerSqlUtils.toTimestamp(r.submittedAt()));
            ps.setTimestamp(10, LedgerSqlUtils.toTimestamp(r.startedAt()));
            ps.setTimestamp(11, LedgerSqlUtils.toTimestamp(r.endedAt()));
            ps.setString(12, r.errorMessage());
            ps.executeUpdate();
        }
        log.info("Ledger entry created | {} | executionId={} | tenant={} | intent={}", TABLE, r.executionId(), r.tenantId(), r.intentType());
    }

    /** Returns false when no row matched. */
    public boolean updateStatus(Connection c, String executionId, ExecutionStatus status, Instant at, String errorMessage)
            throws SQLException {
        String sql = "UPDATE " + TABLE + " SET status = ?,"
                + " started_at = CASE WHEN ? AND started_at IS NULL THEN ? ELSE started_at END,"
                + " ended_at = CASE WHEN ? THEN ? ELSE ended_at END,"
                + " error_message = COALESCE(?, error_message)"
                + " WHERE execution_id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.name());
            ps.setBoolean(2, status == ExecutionStatus.RUNNING);
            ps.setTimestamp(3, LedgerSqlUtils.toTimestamp(at));
            ps.setBoolean(4, status.isTerminal());
            ps.setTimestamp(5, LedgerSqlUtils.toTimestamp(at));
            ps.setString(6, errorMessage);
            ps.setObject(7, LedgerSqlUtils.toUuid(executionId));
            int n = ps.executeUpdate();
            log.debug("Ledger entry updated | {} | executionId={} | status={} | rows={}", TABLE, executionId, status, n);
            return n > 0;
        }
    }

    public Optional<ExecutionRecord> select(Connection c, String executionId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE execution_id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, LedgerSqlUtils.toUuid(executionId));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs, executionId)) : Optional.empty();
            }
        }
    }

    public List<ExecutionRecord> selectByTenant(Connection c, String tenantId, int limit) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE tenant_id = ? ORDER BY submitted_at DESC LIMIT ?";
        List<ExecutionRecord> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tenantId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(rs, rs.getString("execution_id")));
                }
            }
        }
        return out;
    }

    private static ExecutionRecord read(ResultSet rs, String executionId) throws SQLException {
        return new ExecutionRecord(
                executionId,
                rs.getString("intent_id"),
                rs.getString("tenant_id"),
                rs.getString("intent_type"),
                rs.getString("domain"),
                rs.getString("trace_id"),
                LedgerSqlUtils.fromJsonb(rs.getString("inputs")),
                ExecutionStatus.valueOf(rs.getString("status")),
                LedgerSqlUtils.toInstant(rs.getTimestamp("submitted_at")),
                LedgerSqlUtils.toInstant(rs.getTimestamp("started_at")),
                LedgerSqlUtils.toInstant(rs.getTimestamp("ended_at")),
                rs.getString("error_message"),
                List.of());
    }
}
