package de.bsommerfeld.students.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.students.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens JDBC connections for the configured PostgreSQL database.
 *
 * <p>
 * Every call returns a fresh connection; nothing is pooled or reused. Callers
 * own the returned connection and must close it, typically through
 * try-with-resources. Connections are left in auto-commit mode, so each
 * statement commits on its own.
 */
@Singleton
public class ConnectionManager {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

    private final DatabaseConfig config;

    @Inject
    public ConnectionManager(DatabaseConfig config) {
        this.config = config;
    }

    public Connection open() throws SQLException {
        LOG.debug("Opening connection to {}", config.jdbcUrl());
        return DriverManager.getConnection(config.jdbcUrl(), config.user(), config.password());
    }
}
