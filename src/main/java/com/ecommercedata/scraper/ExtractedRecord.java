package com.ecommercedata.scraper;

import java.time.Instant;

/**
 * Immutable product listing scraped from one competitor listing node.
 * <p>
 * Fields that could not be resolved carry their defaults ({@code 0.0} for numbers, empty
 * string for text) rather than failing the record. {@code price} is never negative and
 * {@code rating} always lies in [0.0, 5.0].
 *
 * @param name        product name
 * @param price       cleaned price
 * @param rating      rating normalized to a five-point scale
 * @param imageRef    image URL (absolute when the document had a base URI)
 * @param productUrl  link to the product detail page, empty when the node has none
 * @param category    listing category the node was found in
 * @param sourceTag   site profile tag, e.g. {@code competitor_site}
 * @param listingUrl  URL of the listing page the node was found on
 * @param page        listing page number
 * @param capturedAt  capture timestamp
 */
public record ExtractedRecord(
    String name,
    double price,
    double rating,
    String imageRef,
    String productUrl,
    String category,
    String sourceTag,
    String listingUrl,
    int page,
    Instant capturedAt
) {
    /**
     * Natural key: the product link plus the listing page. Without a link the name, price and
     * image stand in for it.
     */
    public String naturalKey() {
        String product = productUrl == null || productUrl.isBlank()
            ? name + "|" + price + "|" + imageRef
            : productUrl;
        return product + "|" + listingUrl;
    }
}
