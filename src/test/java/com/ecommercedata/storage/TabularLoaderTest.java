package com.ecommercedata.storage;

import com.ecommercedata.scraper.LoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for full-replace loading against an in-memory database.
 */
public class TabularLoaderTest {
    private DatabaseConnector connector;
    private TabularLoader loader;

    @BeforeEach
    void setUp() {
        connector = H2Database.fresh();
        loader = new TabularLoader(connector);
    }

    private long count(String table) throws SQLException {
        try (Connection conn = connector.connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private List<String> columns(String table) throws SQLException {
        try (Connection conn = connector.connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT * FROM " + table)) {
            ResultSetMetaData meta = rs.getMetaData();
            List<String> names = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnLabel(i).toLowerCase());
            }
            return names;
        }
    }

    @Test
    void testSecondLoadReplacesFirst() throws Exception {
        TableData first = TableData.builder("name", "price")
            .row("Lamp", 10.5).row("Rug", 99.0).row("Chair", 45.0).build();
        TableData second = TableData.builder("title", "qty")
            .row("Desk", 1L).row("Shelf", 2L).build();

        loader.load(first, "products");
        LoadResult result = loader.load(second, "products");

        assertEquals(2, result.rowCount());
        assertEquals(2, count("products"));
        assertEquals(List.of("title", "qty"), columns("products"));
        try (Connection conn = connector.connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT title, qty FROM products ORDER BY qty")) {
            assertTrue(rs.next());
            assertEquals("Desk", rs.getString(1));
            assertTrue(rs.next());
            assertEquals("Shelf", rs.getString(1));
            assertFalse(rs.next());
        }
    }

    @Test
    void testLoadCreatesMissingTableAndLeavesNoStaging() throws Exception {
        loader.load(TableData.builder("a").row(1L).build(), "fresh_table");
        Map<String, Long> counts = connector.tableRowCounts();
        assertEquals(Map.of("fresh_table", 1L), counts);
    }

    @Test
    void testColumnNamesAreNormalized() throws Exception {
        TableData data = TableData.builder("Order Date", "Customer-ID", "Unit  Price")
            .row("2024-01-05", 7L, 3.5).build();
        LoadResult result = loader.load(data, "Sales Data");

        assertEquals("sales_data", result.tableName());
        assertEquals(List.of("order_date", "customer_id", "unit_price"), new ArrayList<>(result.columns().keySet()));
        assertEquals(1, count("sales_data"));
    }

    @Test
    void testDateLikeColumnsBecomeTimestamps() throws Exception {
        TableData data = TableData.builder("order_date", "shipped_at", "label")
            .row("2024-01-05", "2024-01-06T08:30:00Z", "2024-01-05")
            .row("01/31/2024", "2024-02-01 12:00:00", "x")
            .row("March 3, 2024", null, "y")
            .build();
        LoadResult result = loader.load(data, "orders");

        assertEquals("TIMESTAMP", result.columns().get("order_date"));
        assertEquals("TIMESTAMP", result.columns().get("shipped_at"));
        assertEquals("TEXT", result.columns().get("label"));
        try (Connection conn = connector.connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT order_date, shipped_at FROM orders ORDER BY order_date")) {
            assertTrue(rs.next());
            assertEquals(Timestamp.valueOf(LocalDateTime.of(2024, 1, 5, 0, 0)), rs.getTimestamp(1));
            assertEquals(Timestamp.valueOf(LocalDateTime.of(2024, 1, 6, 8, 30)), rs.getTimestamp(2));
            assertTrue(rs.next());
            assertEquals(Timestamp.valueOf(LocalDateTime.of(2024, 1, 31, 0, 0)), rs.getTimestamp(1));
            assertTrue(rs.next());
            assertEquals(Timestamp.valueOf(LocalDateTime.of(2024, 3, 3, 0, 0)), rs.getTimestamp(1));
            assertNull(rs.getTimestamp(2));
        }
    }

    @Test
    void testUnparsableDateColumnKeepsText() throws Exception {
        TableData data = TableData.builder("review_date")
            .row("2024-01-05").row("last Tuesday").build();
        LoadResult result = loader.load(data, "reviews");

        assertEquals("TEXT", result.columns().get("review_date"));
        assertEquals(2, result.rowCount());
    }

    @Test
    void testInstantValuesAreStoredAsUtcTimestamps() throws Exception {
        TableData data = TableData.builder("scraped_at").row(Instant.parse("2024-03-01T10:00:00Z")).build();
        LoadResult result = loader.load(data, "captures");
        assertEquals("TIMESTAMP", result.columns().get("scraped_at"));
        try (Connection conn = connector.connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT scraped_at FROM captures")) {
            assertTrue(rs.next());
            assertEquals(Timestamp.valueOf(LocalDateTime.of(2024, 3, 1, 10, 0)), rs.getTimestamp(1));
        }
    }

    @Test
    void testEmptyRowsAreDropped() throws Exception {
        TableData data = TableData.builder("name", "note")
            .row("Lamp", null)
            .row(null, "")
            .row("  ", null)
            .row("Rug", "soft")
            .build();
        LoadResult result = loader.load(data, "items");
        assertEquals(2, result.rowCount());
        assertEquals(2, count("items"));
    }

    @Test
    void testColumnTypesAreInferred() throws Exception {
        TableData data = TableData.builder("id", "price", "active", "tags", "meta")
            .row(1L, 9.99, true, "a", Map.of("k", 1))
            .row(2, 5, false, 3, null)
            .build();
        LoadResult result = loader.load(data, "typed");

        assertEquals("BIGINT", result.columns().get("id"));
        assertEquals("DOUBLE PRECISION", result.columns().get("price"));
        assertEquals("BOOLEAN", result.columns().get("active"));
        assertEquals("TEXT", result.columns().get("tags"));
        assertEquals("TEXT", result.columns().get("meta"));
        try (Connection conn = connector.connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT meta, tags FROM typed ORDER BY id")) {
            assertTrue(rs.next());
            assertEquals("{\"k\":1}", rs.getString(1));
            assertTrue(rs.next());
            assertNull(rs.getString(1));
            assertEquals("3", rs.getString(2));
        }
    }

    @Test
    void testDuplicateNormalizedColumnsFailAndKeepPreviousTable() throws Exception {
        loader.load(TableData.builder("name").row("Lamp").row("Rug").build(), "catalog");

        TableData clash = TableData.builder("Unit Price", "unit-price").row(1.0, 2.0).build();
        LoadException e = assertThrows(LoadException.class, () -> loader.load(clash, "catalog"));
        assertEquals("catalog", e.tableName());
        assertEquals("load", e.stage());

        assertEquals(2, count("catalog"));
        assertEquals(List.of("name"), columns("catalog"));
    }

    @Test
    void testTableWithoutColumnsFails() {
        TableData empty = new TableData(List.of(), List.of());
        assertThrows(LoadException.class, () -> loader.load(empty, "nothing"));
    }

    @Test
    void testLargeLoadIsBatched() throws Exception {
        List<List<Object>> rows = new ArrayList<>();
        for (long i = 0; i < 2_500; i++) {
            rows.add(Arrays.asList(i, "row " + i));
        }
        LoadResult result = loader.load(new TableData(List.of("id", "label"), rows), "bulk");
        assertEquals(2_500, result.rowCount());
        assertEquals(2_500, count("bulk"));
    }

    @Test
    void testEmptyTableIsValid() throws Exception {
        LoadResult result = loader.load(TableData.builder("name", "price").build(), "empty_products");
        assertEquals(0, result.rowCount());
        assertEquals(0, count("empty_products"));
    }

    @Test
    void testCompoundDateNamesBecomeTimestamps() throws Exception {
        TableData data = TableData.builder("orderdate", "birthdate", "updated")
            .row("2024-01-05", "1990-05-17", "yes").build();
        LoadResult result = loader.load(data, "customers");

        assertEquals("TIMESTAMP", result.columns().get("orderdate"));
        assertEquals("TIMESTAMP", result.columns().get("birthdate"));
        // name matches but the value is not a date
        assertEquals("TEXT", result.columns().get("updated"));
    }

    @Test
    void testOverlongTableNameIsRejected() throws Exception {
        String longest = "t".repeat(54);
        loader.load(TableData.builder("a").row(1L).build(), longest);
        assertEquals(1, count(longest));

        LoadException e = assertThrows(LoadException.class,
            () -> loader.load(TableData.builder("a").row(1L).build(), longest + "x"));
        assertEquals(longest + "x", e.tableName());
        assertEquals(Map.of(longest, 1L), connector.tableRowCounts());
    }

    @Test
    void testOverlongColumnNameIsRejected() {
        TableData data = TableData.builder("c".repeat(64)).row(1L).build();
        assertThrows(LoadException.class, () -> loader.load(data, "wide"));
    }
}
