package com.ecommercedata.storage;

import com.ecommercedata.scraper.LoadException;
import com.ecommercedata.scraper.Utils;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full-replace loader for the relational store.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Normalizes column names (lowercase, whitespace and hyphens to {@code _}).</li>
 *   <li>Drops rows whose values are all null or blank.</li>
 *   <li>Parses date-like columns into timestamps; a column with any unparsable value keeps its text.</li>
 *   <li>Infers one SQL type per column from its values.</li>
 *   <li>Writes into a staging table, swaps it in for the target and verifies the row count, all in one transaction.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>Duplicate normalized columns, an empty schema, SQL errors and count mismatches raise {@link LoadException}.</li>
 *   <li>On failure the transaction is rolled back and the staging table dropped; the previous table stays as it was.</li>
 * </ul>
 * One load per table at a time; the loader does no locking of its own.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class TabularLoader implements TabularLoaderInterface {
    private static final Logger logger = LoggerFactory.getLogger(TabularLoader.class);

    static final int BATCH_SIZE = 1000;
    static final String STAGING_SUFFIX = "__staging";
    /** PostgreSQL truncates identifiers beyond this many bytes. */
    static final int MAX_IDENTIFIER_BYTES = 63;

    private final DatabaseConnector connector;

    public TabularLoader(DatabaseConnector connector) {
        this.connector = connector;
    }

    @Override
    public LoadResult load(TableData data, String tableName) throws LoadException {
        String table = Utils.normalizeIdentifier(tableName);
        if (table.isEmpty()) {
            throw new LoadException(String.valueOf(tableName), "Table name is blank");
        }
        if (identifierBytes(table + STAGING_SUFFIX) > MAX_IDENTIFIER_BYTES) {
            throw new LoadException(table, "Table name " + table + " is too long; at most "
                + (MAX_IDENTIFIER_BYTES - STAGING_SUFFIX.length()) + " bytes are allowed");
        }
        List<String> columns = normalizeColumns(data.columns(), table);
        List<List<Object>> rows = dropEmptyRows(data.rows());
        if (rows.size() < data.rowCount()) {
            logger.info("Dropped {} empty rows before loading {}", data.rowCount() - rows.size(), table);
        }

        Map<String, ColumnCoercion.SqlType> schema = new LinkedHashMap<>();
        List<List<Object>> columnValues = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            String column = columns.get(c);
            List<Object> values = new ArrayList<>(rows.size());
            for (List<Object> row : rows) {
                values.add(row.get(c));
            }
            if (ColumnCoercion.isDateLike(column)) {
                List<Object> dates = ColumnCoercion.coerceDates(values);
                if (dates != null) {
                    values = dates;
                } else {
                    logger.warn("Column {}.{} has values that are not dates; keeping text", table, column);
                }
            }
            schema.put(column, ColumnCoercion.inferType(values));
            columnValues.add(values);
        }

        long count = replaceTable(table, schema, columnValues, rows.size());
        Map<String, String> columnTypes = new LinkedHashMap<>();
        schema.forEach((name, type) -> columnTypes.put(name, type.ddl));
        logger.info("Loaded {} rows into table {}", count, table);
        return new LoadResult(table, count, columnTypes);
    }

    static List<String> normalizeColumns(List<String> source, String table) throws LoadException {
        if (source.isEmpty()) {
            throw new LoadException(table, "Table " + table + " has no columns");
        }
        List<String> normalized = new ArrayList<>(source.size());
        Map<String, String> origin = new HashMap<>();
        for (String column : source) {
            String name = Utils.normalizeIdentifier(column);
            if (name.isEmpty()) {
                throw new LoadException(table, "Table " + table + " has a blank column name");
            }
            if (identifierBytes(name) > MAX_IDENTIFIER_BYTES) {
                throw new LoadException(table, "Column name " + name + " in table " + table + " is longer than "
                    + MAX_IDENTIFIER_BYTES + " bytes");
            }
            String previous = origin.putIfAbsent(name, column);
            if (previous != null) {
                throw new LoadException(table, "Columns '" + previous + "' and '" + column
                    + "' both normalize to '" + name + "' in table " + table);
            }
            normalized.add(name);
        }
        return normalized;
    }

    static List<List<Object>> dropEmptyRows(List<List<Object>> rows) {
        List<List<Object>> kept = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (!row.stream().allMatch(ColumnCoercion::isBlank)) {
                kept.add(row);
            }
        }
        return kept;
    }

    private long replaceTable(String table, Map<String, ColumnCoercion.SqlType> schema,
                              List<List<Object>> columnValues, int rowCount) throws LoadException {
        String staging = table + STAGING_SUFFIX;
        try (Connection conn = connector.connect()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("DROP TABLE IF EXISTS " + quote(staging));
                    stmt.execute(createTableSql(staging, schema));
                }
                insertRows(conn, staging, schema, columnValues, rowCount);
                verifyCount(conn, table, staging, rowCount);
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("DROP TABLE IF EXISTS " + quote(table));
                    stmt.execute("ALTER TABLE " + quote(staging) + " RENAME TO " + quote(table));
                }
                long count = verifyCount(conn, table, table, rowCount);
                conn.commit();
                return count;
            } catch (SQLException | LoadException | JsonProcessingException e) {
                rollback(conn, table);
                dropStaging(conn, staging);
                if (e instanceof LoadException) {
                    throw (LoadException) e;
                }
                throw new LoadException(table, "Failed to load table " + table + ": " + e.getMessage(), e);
            } finally {
                if (!conn.isClosed()) {
                    conn.setAutoCommit(autoCommit);
                }
            }
        } catch (SQLException e) {
            logger.error("Database error while loading {}: {}", table, e.getMessage());
            throw new LoadException(table, "Database error while loading " + table + ": " + e.getMessage(), e);
        }
    }

    private static void insertRows(Connection conn, String staging, Map<String, ColumnCoercion.SqlType> schema,
                                   List<List<Object>> columnValues, int rowCount)
            throws SQLException, JsonProcessingException {
        List<ColumnCoercion.SqlType> types = new ArrayList<>(schema.values());
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(quote(staging)).append(" (");
        StringBuilder params = new StringBuilder();
        int i = 0;
        for (String column : schema.keySet()) {
            if (i++ > 0) {
                sql.append(", ");
                params.append(", ");
            }
            sql.append(quote(column));
            params.append('?');
        }
        sql.append(") VALUES (").append(params).append(')');

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int pending = 0;
            for (int r = 0; r < rowCount; r++) {
                for (int c = 0; c < types.size(); c++) {
                    bind(ps, c + 1, types.get(c), columnValues.get(c).get(r));
                }
                ps.addBatch();
                if (++pending == BATCH_SIZE) {
                    ps.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
            }
        }
    }

    private static void bind(PreparedStatement ps, int index, ColumnCoercion.SqlType type, Object value)
            throws SQLException, JsonProcessingException {
        if (ColumnCoercion.isBlank(value)) {
            ps.setNull(index, sqlType(type));
            return;
        }
        switch (type) {
            case BIGINT:
                ps.setLong(index, ((Number) value).longValue());
                break;
            case DOUBLE:
                ps.setDouble(index, ((Number) value).doubleValue());
                break;
            case BOOLEAN:
                ps.setBoolean(index, (Boolean) value);
                break;
            case TIMESTAMP:
                ps.setTimestamp(index, ColumnCoercion.toTimestamp(value));
                break;
            default:
                ps.setString(index, ColumnCoercion.toText(value));
        }
    }

    private static int sqlType(ColumnCoercion.SqlType type) {
        switch (type) {
            case BIGINT:
                return Types.BIGINT;
            case DOUBLE:
                return Types.DOUBLE;
            case BOOLEAN:
                return Types.BOOLEAN;
            case TIMESTAMP:
                return Types.TIMESTAMP;
            default:
                return Types.VARCHAR;
        }
    }

    private static long verifyCount(Connection conn, String table, String physical, int expected)
            throws SQLException, LoadException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + quote(physical))) {
            long actual = rs.next() ? rs.getLong(1) : -1;
            if (actual != expected) {
                throw new LoadException(table, "Row count mismatch in " + physical + ": expected "
                    + expected + " but found " + actual);
            }
            return actual;
        }
    }

    private static String createTableSql(String table, Map<String, ColumnCoercion.SqlType> schema) {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(quote(table)).append(" (");
        int i = 0;
        for (Map.Entry<String, ColumnCoercion.SqlType> column : schema.entrySet()) {
            if (i++ > 0) {
                sql.append(", ");
            }
            sql.append(quote(column.getKey())).append(' ').append(column.getValue().ddl);
        }
        return sql.append(')').toString();
    }

    private static void rollback(Connection conn, String table) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.error("Rollback failed while loading {}: {}", table, e.getMessage());
        }
    }

    private static void dropStaging(Connection conn, String staging) {
        try (Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(true);
            stmt.execute("DROP TABLE IF EXISTS " + quote(staging));
        } catch (SQLException e) {
            logger.warn("Could not drop staging table {}: {}", staging, e.getMessage());
        }
    }

    static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    private static int identifierBytes(String identifier) {
        return identifier.getBytes(StandardCharsets.UTF_8).length;
    }
}
