package com.ecommercedata.scraper;

import org.jsoup.nodes.Document;

/**
 * Source of parsed documents for the crawl. Implemented over plain HTTP ({@link StaticFetcher})
 * and over a headless browser ({@link DynamicFetcher}).
 */
public interface PageFetcherInterface {
    /**
     * Fetches and parses the task's URL.
     *
     * @throws NetworkException when the page cannot be retrieved; the crawl skips the page
     * @throws DriverException  when the browser fails; the crawl stops
     */
    Document fetch(FetchTask task) throws NetworkException, DriverException;
}
