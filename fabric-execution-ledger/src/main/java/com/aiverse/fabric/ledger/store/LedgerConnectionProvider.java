package com.aiverse.fabric.ledger.store;

import com.aiverse.fabric.config.FabricConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.TimeZone;

/**
 * JDBC connections to the ledger database (PostgreSQL, UTC).
 */
public final class LedgerConnectionProvider {

    private final FabricConfig config;

    public LedgerConnectionProvider(FabricConfig config) {
        this.config = Objects.requireNonNull(config, "FabricConfig");
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
    }

    public Connection getConnection() throws SQLException {
        TimeZone prev = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
            return DriverManager.getConnection(jdbcUrl(), config.getDbUser(),
                    config.getDbPassword() != null ? config.getDbPassword() : "");
        } finally {
            TimeZone.setDefault(prev);
        }
    }
}
