package com.ecommercedata.storage;

import com.ecommercedata.scraper.LoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CsvDirectoryLoaderTest {
    @TempDir
    Path dir;

    @Mock
    private TabularLoaderInterface loader;

    private Path write(String relative, String content) throws Exception {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testReadTypesColumns() throws Exception {
        Path file = write("orders.csv", "id,amount,paid,note\n1,10.5,true,first\n2,3,false,\n");
        TableData table = new CsvDirectoryLoader(loader).read(file);

        assertEquals(List.of("id", "amount", "paid", "note"), table.columns());
        assertEquals(Arrays.asList(1L, 10.5, true, "first"), table.rows().get(0));
        assertEquals(Arrays.asList(2L, 3.0, false, null), table.rows().get(1));
    }

    @Test
    void testShortLinesArePadded() throws Exception {
        Path file = write("short.csv", "a,b\nx\n");
        TableData table = new CsvDirectoryLoader(loader).read(file);
        assertEquals(Arrays.asList("x", null), table.rows().get(0));
    }

    @Test
    void testLoadAllWalksTreeAndContinuesAfterFailure() throws Exception {
        write("a/Customer Data.csv", "name\nAnn\n");
        write("b/broken.csv", "name\nBob\n");
        write("b/ignore.txt", "not csv");
        write("c/sales-2024.csv", "total\n5\n");
        when(loader.load(any(TableData.class), eq("customer_data")))
            .thenReturn(new LoadResult("customer_data", 1, Map.of("name", "TEXT")));
        when(loader.load(any(TableData.class), eq("broken")))
            .thenThrow(new LoadException("broken", "boom"));
        when(loader.load(any(TableData.class), eq("sales_2024")))
            .thenReturn(new LoadResult("sales_2024", 1, Map.of("total", "BIGINT")));

        List<LoadResult> results = new CsvDirectoryLoader(loader).loadAll(dir);

        assertEquals(2, results.size());
        assertEquals("customer_data", results.get(0).tableName());
        assertEquals("sales_2024", results.get(1).tableName());
        ArgumentCaptor<String> names = ArgumentCaptor.forClass(String.class);
        verify(loader, times(3)).load(any(TableData.class), names.capture());
        assertEquals(List.of("customer_data", "broken", "sales_2024"), names.getAllValues());
    }

    @Test
    void testLoadAllIntoDatabase() throws Exception {
        write("products.csv", "name,price\nLamp,10.5\nRug,99\n");
        DatabaseConnector connector = H2Database.fresh();

        List<LoadResult> results = new CsvDirectoryLoader(new TabularLoader(connector)).loadAll(dir);

        assertEquals(1, results.size());
        assertEquals("DOUBLE PRECISION", results.get(0).columns().get("price"));
        assertEquals(Map.of("products", 2L), connector.tableRowCounts());
    }

    @Test
    void testTableNameFromFile() {
        assertEquals("weekly_sales", CsvDirectoryLoader.tableName(Path.of("x/Weekly Sales.csv")));
    }
}
