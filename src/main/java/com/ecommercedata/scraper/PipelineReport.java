package com.ecommercedata.scraper;

import com.ecommercedata.storage.LoadResult;

import java.util.Map;

/**
 * Plain-text console report of a run.
 */
public final class PipelineReport {
    private PipelineReport() {}

    public static String format(PipelineSummary summary) {
        StringBuilder report = new StringBuilder();
        report.append("Pipeline Report").append(summary.cancelled() ? " (cancelled)" : "").append("\n");

        if (!summary.crawls().isEmpty()) {
            report.append("\nCrawls:\n");
            for (Map.Entry<String, CrawlResult<?>> entry : summary.crawls().entrySet()) {
                CrawlResult<?> crawl = entry.getValue();
                report.append("  - ").append(entry.getKey()).append(": ")
                    .append(crawl.records().size()).append(" records, ")
                    .append(crawl.pagesFetched()).append(" pages fetched, ")
                    .append(crawl.pagesFailed()).append(" pages skipped, ")
                    .append(crawl.recordsDropped()).append(" records dropped")
                    .append(crawl.cancelled() ? " (cancelled)" : "").append("\n");
            }
        }

        report.append("\nTables loaded: ").append(summary.loads().size()).append("\n");
        for (LoadResult load : summary.loads()) {
            report.append("  - ").append(load.tableName()).append(": ").append(load.rowCount()).append(" rows, ")
                .append(load.columns().size()).append(" columns\n");
        }

        if (summary.hasFailures()) {
            report.append("\nFailures: ").append(summary.failures().size()).append("\n");
            for (PipelineSummary.Failure failure : summary.failures()) {
                report.append("  - ").append(failure.dataset()).append(" [").append(failure.stage()).append("]: ")
                    .append(failure.message()).append("\n");
            }
        }
        return report.toString();
    }

    /**
     * Row counts of every table in the store, the {@code show tables} view.
     */
    public static String formatTables(Map<String, Long> rowCounts) {
        if (rowCounts.isEmpty()) {
            return "No tables found.\n";
        }
        StringBuilder report = new StringBuilder("Tables:\n");
        rowCounts.forEach((table, count) -> report.append("  - ").append(table).append(": ").append(count).append(" rows\n"));
        return report.toString();
    }
}
