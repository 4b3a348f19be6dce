package com.ecommercedata.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes datasets to files next to the database load.
 */
public interface DatasetWriterInterface {
    /**
     * Writes {@code name.csv} and {@code name.json} into {@code directory}, creating it if needed.
     *
     * @return the written files
     * @throws IOException if a file cannot be written
     */
    List<Path> save(TableData table, String name, Path directory) throws IOException;

    /**
     * Writes any value as pretty-printed JSON.
     */
    Path writeJson(Object value, Path file) throws IOException;
}
