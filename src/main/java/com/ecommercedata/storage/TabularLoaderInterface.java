package com.ecommercedata.storage;

import com.ecommercedata.scraper.LoadException;

/**
 * Writes datasets into named tables of the relational store.
 */
public interface TabularLoaderInterface {
    /**
     * Replaces {@code tableName} with the contents of {@code data}: the previous schema and rows
     * are discarded, or the table is created when it did not exist.
     *
     * @return the verified row count and column schema of the new table
     * @throws LoadException on an invalid schema, a SQL failure or a row count mismatch; the
     *                       previous table is left unchanged
     */
    LoadResult load(TableData data, String tableName) throws LoadException;
}
