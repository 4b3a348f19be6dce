package com.ecommercedata.scraper;

/**
 * A table could not be written: bad schema, SQL failure or a row count that does not match
 * after the write. Fatal for that table and never retried.
 */
public class LoadException extends PipelineException {
    private final String tableName;

    public LoadException(String tableName, String message) {
        super("load", message);
        this.tableName = tableName;
    }

    public LoadException(String tableName, String message, Throwable cause) {
        super("load", message, cause);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
