package com.ecommercedata.scraper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Keeps the first record seen for each natural key, in arrival order.
 */
public final class RecordDeduplicator<T> {
    private final Function<T, String> keyFunction;
    private final Map<String, T> records = new LinkedHashMap<>();
    private int duplicates;

    public RecordDeduplicator(Function<T, String> keyFunction) {
        this.keyFunction = keyFunction;
    }

    /**
     * @return false when a record with the same key was already added
     */
    public boolean add(T record) {
        if (records.putIfAbsent(keyFunction.apply(record), record) == null) {
            return true;
        }
        duplicates++;
        return false;
    }

    public List<T> records() {
        return new ArrayList<>(records.values());
    }

    public int duplicates() {
        return duplicates;
    }

    public static <T> List<T> distinct(List<T> input, Function<T, String> keyFunction) {
        RecordDeduplicator<T> deduplicator = new RecordDeduplicator<>(keyFunction);
        input.forEach(deduplicator::add);
        return deduplicator.records();
    }
}
