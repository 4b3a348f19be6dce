package com.ecommercedata.scraper;

import com.ecommercedata.storage.LoadResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one pipeline run produced: loaded tables, crawl statistics and the fatal errors of
 * datasets that could not be loaded.
 */
public final class PipelineSummary {

    /**
     * A dataset that was not loaded.
     *
     * @param dataset table name of the dataset
     * @param stage   stage that failed ({@code fetch}, {@code browser}, {@code load}, ...)
     * @param message error message
     */
    public record Failure(String dataset, String stage, String message) {
    }

    private final List<LoadResult> loads = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();
    private final Map<String, CrawlResult<?>> crawls = new LinkedHashMap<>();
    private boolean cancelled;

    void loaded(LoadResult result) {
        loads.add(result);
    }

    void failed(String dataset, PipelineException error) {
        failures.add(new Failure(dataset, error.stage(), error.getMessage()));
    }

    void failed(String dataset, String stage, String message) {
        failures.add(new Failure(dataset, stage, message));
    }

    void crawled(String dataset, CrawlResult<?> result) {
        crawls.put(dataset, result);
    }

    void markCancelled() {
        cancelled = true;
    }

    public List<LoadResult> loads() {
        return Collections.unmodifiableList(loads);
    }

    public List<Failure> failures() {
        return Collections.unmodifiableList(failures);
    }

    public Map<String, CrawlResult<?>> crawls() {
        return Collections.unmodifiableMap(crawls);
    }

    public boolean cancelled() {
        return cancelled;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
