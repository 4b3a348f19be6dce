package com.ecommercedata.scraper;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns document nodes into typed records using a {@link SiteProfile}.
 * <p>
 * Field extraction never throws: a field that cannot be resolved gets its default
 * ({@code 0.0} for numbers, empty string for text), so every node found yields a record.
 * <p>
 * Rating fallback chain, first match wins:
 * <ol>
 *   <li>"X out of Y"</li>
 *   <li>"X/Y"</li>
 *   <li>number of filled-star markers</li>
 *   <li>first number in the text (reviews only)</li>
 *   <li>0.0</li>
 * </ol>
 * Ratings on another scale are rescaled to five and always clamped to [0.0, 5.0].
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class ExtractionRules {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionRules.class);

    static final double MAX_RATING = 5.0;

    private static final Pattern OUT_OF = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*out\\s+of\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SLASH = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern NOT_PRICE = Pattern.compile("[^\\d.]");

    private final SiteProfile profile;

    public ExtractionRules(SiteProfile profile) {
        this.profile = profile;
    }

    public SiteProfile profile() {
        return profile;
    }

    /**
     * Extracts every listing node of the document, in document order.
     */
    public List<ExtractedRecord> extractListings(Document document, ExtractionContext context) {
        List<ExtractedRecord> records = new ArrayList<>();
        Elements nodes = document.select(profile.listingContainer());
        if (nodes.isEmpty()) {
            logger.warn("No '{}' nodes on {} (category={}, page={})",
                profile.listingContainer(), context.pageUrl(), context.category(), context.page());
        }
        for (Element node : nodes) {
            toProduct(node, context).ifPresent(records::add);
        }
        return records;
    }

    /**
     * Extracts up to {@code limit} review nodes of the document.
     */
    public List<ReviewRecord> extractReviews(Document document, ExtractionContext context, int limit) {
        List<ReviewRecord> records = new ArrayList<>();
        for (Element node : document.select(profile.reviewContainer())) {
            if (records.size() >= limit) {
                break;
            }
            toReview(node, context).ifPresent(records::add);
        }
        return records;
    }

    /**
     * Record of one listing node. Unresolved fields keep their defaults; only a missing node
     * yields no record.
     */
    public Optional<ExtractedRecord> toProduct(Element node, ExtractionContext context) {
        if (node == null) {
            logger.warn("Missing listing node on {} (category={}, page={})",
                context.pageUrl(), context.category(), context.page());
            return Optional.empty();
        }
        String name = text(node, profile.rule(SiteProfile.NAME));
        String link = text(node, profile.rule(SiteProfile.LINK));
        if (name.isEmpty() && link.isEmpty()) {
            logger.debug("Listing node on {} has neither a name nor a link; keeping defaults", context.pageUrl());
        }
        return Optional.of(new ExtractedRecord(
            name,
            cleanPrice(text(node, profile.rule(SiteProfile.PRICE))),
            rating(node, profile.rule(SiteProfile.RATING), false),
            text(node, profile.rule(SiteProfile.IMAGE)),
            link,
            context.category(),
            profile.sourceTag(),
            context.pageUrl(),
            context.page(),
            context.capturedAt()));
    }

    /**
     * Record of one review node, with the same defaulting as {@link #toProduct}.
     */
    public Optional<ReviewRecord> toReview(Element node, ExtractionContext context) {
        if (node == null) {
            logger.warn("Missing review node on {}", context.pageUrl());
            return Optional.empty();
        }
        return Optional.of(new ReviewRecord(
            context.pageUrl(),
            text(node, profile.rule(SiteProfile.REVIEWER)),
            rating(node, profile.rule(SiteProfile.REVIEW_RATING), true),
            text(node, profile.rule(SiteProfile.REVIEW_TEXT)),
            text(node, profile.rule(SiteProfile.REVIEW_DATE)),
            context.capturedAt()));
    }

    /**
     * First non-blank value produced by the rule's selectors, or "".
     */
    public String text(Element node, FieldRule rule) {
        for (String selector : rule.selectors) {
            Element element = node.selectFirst(selector);
            if (element == null) {
                continue;
            }
            String value;
            if (rule.readsAttribute()) {
                value = element.absUrl(rule.attribute);
                if (value.isEmpty()) {
                    value = element.attr(rule.attribute);
                }
            } else {
                value = element.text();
            }
            value = value.trim();
            if (!value.isEmpty()) {
                return value;
            }
            logger.debug("Selector '{}' for {} matched an empty value", selector, rule.fieldName);
        }
        return "";
    }

    /**
     * Keeps digits and the decimal point and parses the rest, e.g. "$1,234.56" to 1234.56.
     *
     * @return the price, or 0.0 when nothing parsable remains
     */
    public static double cleanPrice(String raw) {
        if (raw == null) {
            return 0.0;
        }
        String digits = NOT_PRICE.matcher(raw).replaceAll("");
        if (digits.isEmpty()) {
            return 0.0;
        }
        try {
            double value = Double.parseDouble(digits);
            return Double.isFinite(value) && value > 0 ? value : 0.0;
        } catch (NumberFormatException e) {
            logger.debug("Unparsable price '{}'", raw);
            return 0.0;
        }
    }

    /**
     * Rating text parsed through the fallback chain, without the star count.
     */
    public static double parseRating(String raw, boolean allowFirstNumber) {
        if (raw == null || raw.isBlank()) {
            return 0.0;
        }
        Matcher outOf = OUT_OF.matcher(raw);
        if (outOf.find()) {
            return scaled(outOf.group(1), outOf.group(2));
        }
        Matcher slash = SLASH.matcher(raw);
        if (slash.find()) {
            return scaled(slash.group(1), slash.group(2));
        }
        if (allowFirstNumber) {
            Matcher number = FIRST_NUMBER.matcher(raw);
            if (number.find()) {
                return clamp(Double.parseDouble(number.group()));
            }
        }
        return 0.0;
    }

    private double rating(Element node, FieldRule rule, boolean allowFirstNumber) {
        Element ratingElement = null;
        for (String selector : rule.selectors) {
            ratingElement = node.selectFirst(selector);
            if (ratingElement != null) {
                break;
            }
        }
        if (ratingElement == null) {
            return 0.0;
        }
        String raw = ratingElement.text();
        // Pattern matches take precedence over the star count.
        double parsed = parseRating(raw, false);
        if (parsed > 0.0 || OUT_OF.matcher(raw).find() || SLASH.matcher(raw).find()) {
            return parsed;
        }
        int stars = ratingElement.select(profile.starSelector()).size();
        if (stars > 0) {
            return clamp(stars);
        }
        return allowFirstNumber ? parseRating(raw, true) : 0.0;
    }

    private static double scaled(String value, String scale) {
        double x = Double.parseDouble(value);
        double y = Double.parseDouble(scale);
        if (y <= 0) {
            return clamp(x);
        }
        return clamp(x / y * MAX_RATING);
    }

    static double clamp(double rating) {
        if (Double.isNaN(rating) || rating < 0) {
            return 0.0;
        }
        return Math.min(MAX_RATING, rating);
    }
}
