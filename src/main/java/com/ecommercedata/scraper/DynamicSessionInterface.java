package com.ecommercedata.scraper;

import org.jsoup.nodes.Document;

/**
 * A headless browser session that renders script-driven pages.
 * <p>
 * A session owns one browser and one page. It is not thread-safe and must be closed on every
 * exit path; closing twice is harmless.
 */
public interface DynamicSessionInterface extends AutoCloseable {
    /**
     * Loads {@code url} and waits for {@code markerSelector} to appear.
     *
     * @return false when the marker did not show up within the wait limit; the page is still usable
     * @throws NetworkException when the navigation itself fails
     * @throws DriverException  when the browser is gone
     */
    boolean navigate(String url, String markerSelector) throws NetworkException, DriverException;

    /**
     * Parses the rendered page. Returns an empty document when the last navigation did not find
     * its marker.
     */
    Document render() throws DriverException;

    @Override
    void close();
}
