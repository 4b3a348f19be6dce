package com.ecommercedata.scraper;

import java.time.Instant;

/**
 * Immutable product review taken from a browser-rendered review page.
 *
 * @param productUrl   page the review was rendered on
 * @param reviewerName reviewer display name, empty when missing
 * @param rating       rating normalized to a five-point scale
 * @param text         review body
 * @param reviewDate   review date as printed on the page
 * @param capturedAt   capture timestamp
 */
public record ReviewRecord(
    String productUrl,
    String reviewerName,
    double rating,
    String text,
    String reviewDate,
    Instant capturedAt
) {
    /**
     * Natural key: reviewer, date and text. The same review rendered twice shares this key.
     */
    public String naturalKey() {
        return reviewerName + "|" + reviewDate + "|" + text;
    }
}
