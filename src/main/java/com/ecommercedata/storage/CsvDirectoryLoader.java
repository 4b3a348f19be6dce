package com.ecommercedata.storage;

import com.ecommercedata.scraper.LoadException;
import com.ecommercedata.scraper.Utils;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads every CSV file under a directory tree into its own table, named after the file.
 * <p>
 * Column values are typed before loading: a column whose non-blank cells are all integers becomes
 * numeric, likewise decimals and booleans; everything else stays text. A file that fails is logged
 * and the remaining files are still loaded.
 */
public class CsvDirectoryLoader {
    private static final Logger logger = LoggerFactory.getLogger(CsvDirectoryLoader.class);

    private final TabularLoaderInterface loader;

    public CsvDirectoryLoader(TabularLoaderInterface loader) {
        this.loader = loader;
    }

    /**
     * @return results of the files that loaded, in file path order
     * @throws IOException if the directory cannot be walked
     */
    public List<LoadResult> loadAll(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                .sorted()
                .collect(Collectors.toList());
        }
        logger.info("Found {} CSV files under {}", files.size(), directory);

        List<LoadResult> results = new ArrayList<>();
        for (Path file : files) {
            String table = tableName(file);
            try {
                LoadResult result = loader.load(read(file), table);
                results.add(result);
                logger.info("Loaded {} -> {} ({} rows)", file, result.tableName(), result.rowCount());
            } catch (IOException | CsvException e) {
                logger.error("Could not read {}: {}", file, e.getMessage());
            } catch (LoadException e) {
                logger.error("Could not load {} into {}: {}", file, table, e.getMessage());
            }
        }
        return results;
    }

    static String tableName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return Utils.normalizeIdentifier(dot > 0 ? fileName.substring(0, dot) : fileName);
    }

    /**
     * Reads a CSV file with a header row into typed columns.
     */
    public TableData read(Path file) throws IOException, CsvException {
        List<String[]> lines;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            lines = reader.readAll();
        }
        if (lines.isEmpty()) {
            return new TableData(List.of(), List.of());
        }
        List<String> header = Arrays.asList(lines.get(0));
        List<List<String>> cells = new ArrayList<>();
        for (String[] line : lines.subList(1, lines.size())) {
            List<String> row = new ArrayList<>(header.size());
            for (int c = 0; c < header.size(); c++) {
                row.add(c < line.length ? line[c] : "");
            }
            cells.add(row);
        }

        List<List<Object>> rows = new ArrayList<>(cells.size());
        for (int r = 0; r < cells.size(); r++) {
            rows.add(new ArrayList<>(header.size()));
        }
        for (int c = 0; c < header.size(); c++) {
            ValueKind kind = ValueKind.of(cells, c);
            for (int r = 0; r < cells.size(); r++) {
                rows.get(r).add(kind.convert(cells.get(r).get(c)));
            }
        }
        return new TableData(header, rows);
    }

    private enum ValueKind {
        INTEGER, DECIMAL, BOOLEAN, TEXT;

        static ValueKind of(List<List<String>> cells, int column) {
            boolean integer = true;
            boolean decimal = true;
            boolean bool = true;
            boolean seen = false;
            for (List<String> row : cells) {
                String value = row.get(column).trim();
                if (value.isEmpty()) {
                    continue;
                }
                seen = true;
                integer &= value.matches("[-+]?\\d{1,18}");
                decimal &= value.matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
                bool &= value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false");
            }
            if (!seen) {
                return TEXT;
            }
            if (integer) {
                return INTEGER;
            }
            if (decimal) {
                return DECIMAL;
            }
            return bool ? BOOLEAN : TEXT;
        }

        Object convert(String raw) {
            String value = raw.trim();
            if (value.isEmpty()) {
                return null;
            }
            switch (this) {
                case INTEGER:
                    return Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
                case DECIMAL:
                    return Double.parseDouble(value);
                case BOOLEAN:
                    return Boolean.parseBoolean(value);
                default:
                    return raw;
            }
        }
    }
}
