package com.ecommercedata.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one full-replace load.
 *
 * @param tableName table that was replaced
 * @param rowCount  rows in the table after the write, as read back from the store
 * @param columns   normalized column name to SQL type, in table order
 */
public record LoadResult(String tableName, long rowCount, Map<String, String> columns) {
    public LoadResult {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }
}
