package com.ecommercedata.scraper;

import java.util.List;

/**
 * Records accumulated by one crawl plus the page statistics the report prints.
 * An empty record list is a valid outcome.
 *
 * @param records      deduplicated records in crawl order
 * @param pagesFetched pages whose document was fetched (including empty ones)
 * @param pagesFailed  pages skipped because of a network error
 * @param recordsDropped records discarded as duplicates or for an out-of-range timestamp
 * @param cancelled    true when the crawl stopped at a cancellation boundary
 */
public record CrawlResult<T>(List<T> records, int pagesFetched, int pagesFailed, int recordsDropped, boolean cancelled) {
    public CrawlResult {
        records = List.copyOf(records);
    }

    public static <T> CrawlResult<T> empty() {
        return new CrawlResult<>(List.of(), 0, 0, 0, false);
    }
}
