package com.ecommercedata.scraper;

import org.jsoup.nodes.Document;

/**
 * Page fetcher that renders each URL in an open {@link DynamicSessionInterface}.
 * The session is owned by the caller.
 */
public class DynamicFetcher implements PageFetcherInterface {
    private final DynamicSessionInterface session;
    private final String markerSelector;

    public DynamicFetcher(DynamicSessionInterface session, String markerSelector) {
        this.session = session;
        this.markerSelector = markerSelector;
    }

    @Override
    public Document fetch(FetchTask task) throws NetworkException, DriverException {
        task.recordAttempt();
        session.navigate(task.url(), markerSelector);
        return session.render();
    }
}
