package com.ecommercedata.scraper;

/**
 * An expected structural marker is missing from a document or JSON payload.
 * <p>
 * Always recovered where it is raised: the record (or keyword) is skipped and the crawl goes on.
 */
public class MarkupParseException extends PipelineException {
    public MarkupParseException(String message) {
        super("extract", message);
    }

    public MarkupParseException(String message, Throwable cause) {
        super("extract", message, cause);
    }
}
