package com.ecommercedata.scraper;

/**
 * One unit of crawl work: a (category, page) pair and the URL that serves it.
 * <p>
 * Created by {@link CrawlOrchestrator}; only the retry logic touches the attempt counter.
 * Discarded once the page has been fetched or its retries are exhausted.
 */
public final class FetchTask {
    private final String category;
    private final int page;
    private final String url;
    private int attempts;

    public FetchTask(String category, int page, String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("FetchTask url must not be blank");
        }
        this.category = category == null ? "" : category;
        this.page = page;
        this.url = url;
    }

    /**
     * Task for a standalone URL that does not belong to a category listing.
     */
    public static FetchTask forUrl(String url) {
        return new FetchTask("", 1, url);
    }

    public String category() {
        return category;
    }

    public int page() {
        return page;
    }

    public String url() {
        return url;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Counts one more attempt and returns the new total.
     */
    public int recordAttempt() {
        return ++attempts;
    }

    @Override
    public String toString() {
        return "FetchTask[category=" + category + ", page=" + page + ", url=" + url + ", attempts=" + attempts + "]";
    }
}
