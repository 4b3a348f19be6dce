package com.ecommercedata.scraper;

/**
 * Lifecycle of one {@link CrawlOrchestrator} run.
 */
public enum CrawlState {
    IDLE,
    PAGINATING,
    FETCHING,
    EXTRACTING,
    ACCUMULATING,
    DONE,
    CANCELLED,
    FAILED
}
