package com.aiverse.fabric.ledger.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Loads and executes the ledger schema script (fabric_execution, fabric_execution_unit).
 * Runs at most once per instance.
 */
public final class LedgerSchemaBootstrapper {

    public static final String SCHEMA_RESOURCE = "schema/fabric-ledger.sql";
    private static final Logger log = LoggerFactory.getLogger(LedgerSchemaBootstrapper.class);

    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    /**
     * Creates ledger tables and indexes if they do not exist.
     *
     * @throws IllegalStateException if the script cannot be loaded or a statement fails
     */
    public void ensureSchema(ConnectionProvider connectionProvider) {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Ledger schema already initialized; skipping");
            return;
        }
        List<String> statements = statements(loadSchemaScript());
        int total = statements.size();
        log.info("Ledger schema: executing {} statement(s)", total);
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                log.info("Ledger schema: executing statement {}/{}: {}", index, total, preview);
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    log.error("Ledger schema: statement {}/{} failed. SQL: {} | SQLState: {}", index, total, preview, e.getSQLState(), e);
                    schemaInitialized.set(false);
                    throw new IllegalStateException("Ledger schema execution failed at statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Ledger schema: tables fabric_execution, fabric_execution_unit are ready");
        } catch (SQLException e) {
            schemaInitialized.set(false);
            log.error("Ledger schema: connection failed. error={} SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new IllegalStateException("Ledger schema execution failed: " + e.getMessage(), e);
        }
    }

    /** Splits a script on ';', dropping comment lines and empty statements. */
    public static List<String> statements(String sql) {
        List<String> out = new ArrayList<>();
        for (String raw : sql.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) out.add(stmt);
        }
        return out;
    }

    static String loadSchemaScript() {
        try (var in = LedgerSchemaBootstrapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Ledger schema resource not found: " + SCHEMA_RESOURCE);
            }
            String sql = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
            log.info("Ledger schema: loaded {} characters from {}", sql.length(), SCHEMA_RESOURCE);
            return sql;
        } catch (IOException e) {
            throw new IllegalStateException("Ledger schema load failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }
}
