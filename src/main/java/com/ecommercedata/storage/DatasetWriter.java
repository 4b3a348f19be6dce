package com.ecommercedata.storage;

import com.ecommercedata.scraper.JsonSupport;
import com.ecommercedata.scraper.Utils;
import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports datasets as CSV (OpenCSV, header row) and JSON (Jackson, array of objects).
 * <p>
 * Workflow:
 * <ul>
 *   <li>Sanitizes the dataset name into a file name.</li>
 *   <li>Writes values as text; timestamps in ISO-8601, nulls as empty cells.</li>
 *   <li>Writes the same rows as JSON objects keyed by column name.</li>
 * </ul>
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class DatasetWriter implements DatasetWriterInterface {
    private static final Logger logger = LoggerFactory.getLogger(DatasetWriter.class);

    @Override
    public List<Path> save(TableData table, String name, Path directory) throws IOException {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Dataset name cannot be null or empty");
        }
        Files.createDirectories(directory);
        String baseName = Utils.sanitizeFilename(name.trim());
        Path csv = directory.resolve(baseName + ".csv");
        Path json = directory.resolve(baseName + ".json");

        try (Writer out = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(table.columns().toArray(new String[0]));
            for (List<Object> row : table.rows()) {
                String[] cells = new String[row.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = safe(row.get(i));
                }
                writer.writeNext(cells);
            }
        }

        List<Map<String, Object>> objects = new ArrayList<>(table.rowCount());
        for (List<Object> row : table.rows()) {
            Map<String, Object> object = new LinkedHashMap<>();
            for (int i = 0; i < row.size(); i++) {
                object.put(table.columns().get(i), row.get(i));
            }
            objects.add(object);
        }
        writeJson(objects, json);
        logger.info("Wrote {} rows of {} to {} and {}", table.rowCount(), name, csv, json);
        return List.of(csv, json);
    }

    @Override
    public Path writeJson(Object value, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        JsonSupport.mapper().writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        return file;
    }

    /**
     * Text form of a cell with line breaks collapsed into a single space.
     */
    static String safe(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof TemporalAccessor ? value.toString() : String.valueOf(value);
        return text.replaceAll("[\\r\\n]+", " ").trim();
    }
}
