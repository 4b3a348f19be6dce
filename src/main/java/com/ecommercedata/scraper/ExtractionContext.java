package com.ecommercedata.scraper;

import java.time.Instant;

/**
 * Where a document came from. Copied onto every record extracted from it.
 *
 * @param category   listing category, empty for review pages
 * @param page       page number within the category
 * @param pageUrl    URL of the fetched document
 * @param capturedAt capture timestamp for all records of the document
 */
public record ExtractionContext(String category, int page, String pageUrl, Instant capturedAt) {
    public static ExtractionContext of(FetchTask task, Instant capturedAt) {
        return new ExtractionContext(task.category(), task.page(), task.url(), capturedAt);
    }
}
