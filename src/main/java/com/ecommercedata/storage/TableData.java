package com.ecommercedata.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A dataset ready to be written: ordered column names and rows of values in column order.
 * Values may be null; the loader decides the SQL type per column.
 */
public record TableData(List<String> columns, List<List<Object>> rows) {
    public TableData {
        columns = List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " values but table has "
                    + columns.size() + " columns");
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public int rowCount() {
        return rows.size();
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public static final class Builder {
        private final List<String> columns;
        private final List<List<Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = new ArrayList<>(columns);
        }

        public Builder row(Object... values) {
            rows.add(Arrays.asList(values));
            return this;
        }

        public Builder row(List<Object> values) {
            rows.add(values);
            return this;
        }

        public TableData build() {
            return new TableData(columns, rows);
        }
    }
}
