package com.ecommercedata.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches server-rendered HTML with {@link RetryingHttpClient} and parses it with Jsoup,
 * keeping the page URL as base URI so relative links resolve.
 */
public class StaticFetcher implements PageFetcherInterface {
    private static final Logger logger = LoggerFactory.getLogger(StaticFetcher.class);

    private final RetryingHttpClient client;

    public StaticFetcher(RetryingHttpClient client) {
        this.client = client;
    }

    @Override
    public Document fetch(FetchTask task) throws NetworkException {
        String body = client.get(task);
        Document document = Jsoup.parse(body, task.url());
        logger.debug("Parsed {} ({} chars)", task.url(), body.length());
        return document;
    }
}
