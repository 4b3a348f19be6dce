package com.ecommercedata.scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural template of one competitor site: where records live in a page and how each field
 * is found inside a record.
 * <p>
 * Chosen once when the crawl is built and handed to {@link ExtractionRules}; nothing downstream
 * branches on which site is being scraped.
 * <p>
 * Field names used by {@link ExtractionRules}:
 * <ul>
 *   <li>listings: {@code name}, {@code price}, {@code rating}, {@code image}, {@code link}</li>
 *   <li>reviews: {@code reviewer}, {@code reviewRating}, {@code reviewText}, {@code reviewDate}</li>
 * </ul>
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public final class SiteProfile {
    public static final String NAME = "name";
    public static final String PRICE = "price";
    public static final String RATING = "rating";
    public static final String IMAGE = "image";
    public static final String LINK = "link";
    public static final String REVIEWER = "reviewer";
    public static final String REVIEW_RATING = "reviewRating";
    public static final String REVIEW_TEXT = "reviewText";
    public static final String REVIEW_DATE = "reviewDate";

    private final String sourceTag;
    private final String listingContainer;
    private final String reviewContainer;
    private final String markerSelector;
    private final String starSelector;
    private final Map<String, FieldRule> rules;

    public SiteProfile(String sourceTag, String listingContainer, String reviewContainer,
                       String markerSelector, String starSelector, List<FieldRule> rules) {
        this.sourceTag = sourceTag;
        this.listingContainer = listingContainer;
        this.reviewContainer = reviewContainer;
        this.markerSelector = markerSelector;
        this.starSelector = starSelector;
        Map<String, FieldRule> byName = new LinkedHashMap<>();
        for (FieldRule rule : rules) {
            if (byName.put(rule.fieldName, rule) != null) {
                throw new IllegalArgumentException("Duplicate rule for field " + rule.fieldName);
            }
        }
        this.rules = Collections.unmodifiableMap(byName);
    }

    /**
     * Template of the default competitor site.
     */
    public static SiteProfile defaults() {
        return new SiteProfile(
            "competitor_site",
            "div.product-item",
            ".review-item",
            ".review-item",
            "span.star-filled",
            List.of(
                FieldRule.text(NAME, "h3.product-name", ".product-name", "h3"),
                FieldRule.text(PRICE, "span.price", ".price"),
                FieldRule.text(RATING, "div.rating", ".rating"),
                FieldRule.attribute(IMAGE, "src", "img[src]", "img[data-src]"),
                FieldRule.attribute(LINK, "href", "a.product-link[href]", "a[href]"),
                FieldRule.text(REVIEWER, ".reviewer-name"),
                FieldRule.text(REVIEW_RATING, ".review-rating"),
                FieldRule.text(REVIEW_TEXT, ".review-text"),
                FieldRule.text(REVIEW_DATE, ".review-date")
            ));
    }

    /**
     * Returns the rule for a field, or an empty rule that never matches.
     */
    public FieldRule rule(String fieldName) {
        FieldRule rule = rules.get(fieldName);
        return rule != null ? rule : new FieldRule(fieldName, List.of(), null);
    }

    public List<String> fieldNames() {
        return new ArrayList<>(rules.keySet());
    }

    public String sourceTag() {
        return sourceTag;
    }

    public String listingContainer() {
        return listingContainer;
    }

    public String reviewContainer() {
        return reviewContainer;
    }

    public String markerSelector() {
        return markerSelector;
    }

    public String starSelector() {
        return starSelector;
    }
}
