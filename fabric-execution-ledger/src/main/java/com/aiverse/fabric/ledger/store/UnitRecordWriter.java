package com.aiverse.fabric.ledger.store;

import com.aiverse.fabric.ledger.UnitRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes rows of fabric_execution_unit.
 */
public final class UnitRecordWriter {

    private static final Logger log = LoggerFactory.getLogger(UnitRecordWriter.class);
    private static final String TABLE = "fabric_execution_unit";

    public void insert(Connection c, UnitRecord r) throws SQLException {
        String sql = "INSERT INTO " + TABLE + " (execution_id, unit_id, capability_type, input, output, succeeded, "
                + "error_code, error_message, recorded_at, duration_ms) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, LedgerSqlUtils.toUuid(r.executionId()));
            ps.setString(2, LedgerSqlUtils.toName(r.unitId(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setString(3, LedgerSqlUtils.toName(r.capabilityType(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setObject(4, LedgerSqlUtils.toJsonb(r.input()));
            ps.setObject(5, LedgerSqlUtils.toJsonb(r.output()));
            ps.setBoolean(6, r.succeeded());
            ps.setString(7, LedgerSqlUtils.toName(r.errorCode(), 64));
            ps.setString(8, r.errorMessage());
            ps.setTimestamp(9, LedgerSqlUtils.toTimestamp(r.recordedAt()));
            ps.setLong(10, r.durationMs());
            ps.executeUpdate();
        }
        log.info("Ledger entry created | {} | executionId={} | unit={} | succeeded={}", TABLE, r.executionId(), r.unitId(), r.succeeded());
    }

    public List<UnitRecord> selectByExecution(Connection c, String executionId) throws SQLException {
        String sql = "SELECT unit_id, capability_type, input, output, succeeded, error_code, error_message, recorded_at, duration_ms"
                + " FROM " + TABLE + " WHERE execution_id = ? ORDER BY id";
        List<UnitRecord> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, LedgerSqlUtils.toUuid(executionId));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new UnitRecord(
                            executionId,
                            rs.getString("unit_id"),
                            rs.getString("capability_type"),
                            LedgerSqlUtils.fromJsonb(rs.getString("input")),
                            LedgerSqlUtils.fromJsonb(rs.getString("output")),
                            rs.getBoolean("succeeded"),
                            rs.getString("error_code"),
                            rs.getString("error_message"),
                            LedgerSqlUtils.toInstant(rs.getTimestamp("recorded_at")),
                            rs.getLong("duration_ms")));
                }
            }
        }
        return out;
    }
}
