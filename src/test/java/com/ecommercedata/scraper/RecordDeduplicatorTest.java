package com.ecommercedata.scraper;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for natural-key deduplication.
 */
public class RecordDeduplicatorTest {
    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void testIdenticalReviewsCollapseToFirstOccurrence() {
        ReviewRecord first = new ReviewRecord("http://shop.test/a", "Alice", 5.0, "Great", "2024-01-05", T);
        ReviewRecord sameKeyOtherPage = new ReviewRecord("http://shop.test/b", "Alice", 4.0, "Great", "2024-01-05", T.plusSeconds(5));
        ReviewRecord other = new ReviewRecord("http://shop.test/a", "Alice", 5.0, "Great", "2024-01-06", T);

        RecordDeduplicator<ReviewRecord> dedup = new RecordDeduplicator<>(ReviewRecord::naturalKey);
        assertTrue(dedup.add(first));
        assertFalse(dedup.add(sameKeyOtherPage));
        assertTrue(dedup.add(other));

        assertEquals(List.of(first, other), dedup.records());
        assertEquals(1, dedup.duplicates());
    }

    @Test
    void testListingKeyUsesLinkAndPage() {
        ExtractedRecord a = new ExtractedRecord("Lamp", 10, 4, "", "http://shop.test/p/lamp", "home", "competitor_site",
            "http://shop.test/category/home?page=1", 1, T);
        ExtractedRecord samePage = new ExtractedRecord("Lamp (new)", 12, 4, "", "http://shop.test/p/lamp", "home", "competitor_site",
            "http://shop.test/category/home?page=1", 1, T);
        ExtractedRecord nextPage = new ExtractedRecord("Lamp", 10, 4, "", "http://shop.test/p/lamp", "home", "competitor_site",
            "http://shop.test/category/home?page=2", 2, T);
        ExtractedRecord noLink = new ExtractedRecord("Rug", 10, 4, "", "", "home", "competitor_site",
            "http://shop.test/category/home?page=1", 1, T);

        List<ExtractedRecord> distinct = RecordDeduplicator.distinct(List.of(a, samePage, nextPage, noLink), ExtractedRecord::naturalKey);
        assertEquals(List.of(a, nextPage, noLink), distinct);
    }

    @Test
    void testListingsWithoutLinkOrNameStayDistinct() {
        ExtractedRecord cheap = new ExtractedRecord("", 3, 4, "http://shop.test/img/a.jpg", "", "home", "competitor_site",
            "http://shop.test/category/home?page=1", 1, T);
        ExtractedRecord dear = new ExtractedRecord("", 30, 4, "http://shop.test/img/b.jpg", "", "home", "competitor_site",
            "http://shop.test/category/home?page=1", 1, T);

        List<ExtractedRecord> distinct = RecordDeduplicator.distinct(List.of(cheap, dear, cheap), ExtractedRecord::naturalKey);
        assertEquals(List.of(cheap, dear), distinct);
    }
}
