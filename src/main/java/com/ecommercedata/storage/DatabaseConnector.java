package com.ecommercedata.storage;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection descriptor for the relational store, plus the embedded PostgreSQL used for local runs.
 * <p>
 * Every call opens its own connection; the store's transactions are the only coordination.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class DatabaseConnector {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnector.class);

    private final String url;
    private final String user;
    private final String password;

    /**
     * @param url      JDBC URL
     * @param user     database user
     * @param password database password
     */
    public DatabaseConnector(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Connector for the {@code postgres} database of an embedded instance.
     */
    public static DatabaseConnector forEmbedded(EmbeddedPostgres postgres) {
        return new DatabaseConnector(
            String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort()), "postgres", "postgres");
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    public String url() {
        return url;
    }

    /**
     * @return true when the store answers {@code SELECT 1}
     */
    public boolean ping() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            logger.warn("Database at {} is not reachable: {}", url, e.getMessage());
            return false;
        }
    }

    /**
     * Row count of every table in the connection's current schema, by table name.
     */
    public Map<String, Long> tableRowCounts() throws SQLException {
        Map<String, Long> counts = new LinkedHashMap<>();
        try (Connection conn = connect()) {
            List<String> tables = new ArrayList<>();
            DatabaseMetaData meta = conn.getMetaData();
            try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), "%", null)) {
                while (rs.next()) {
                    String type = rs.getString("TABLE_TYPE");
                    // H2 reports plain tables as BASE TABLE
                    if ("TABLE".equals(type) || "BASE TABLE".equals(type)) {
                        tables.add(rs.getString("TABLE_NAME"));
                    }
                }
            }
            tables.sort(String::compareTo);
            try (Statement stmt = conn.createStatement()) {
                for (String table : tables) {
                    try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + TabularLoader.quote(table))) {
                        rs.next();
                        counts.put(table, rs.getLong(1));
                    }
                }
            }
        }
        return counts;
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(Path dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(dataDir)
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (IOException e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new IllegalStateException("Embedded PostgreSQL did not start on port " + port, e);
        }
    }
}
