package com.ecommercedata.scraper;

import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Drives one sequential crawl: builds a {@link FetchTask} per page, fetches it, extracts records
 * and paces the next request.
 * <p>
 * Workflow per task:
 * <ul>
 *   <li>Stop if the {@link CancellationToken} was cancelled or the thread interrupted.</li>
 *   <li>Fetch through the configured {@link PageFetcherInterface} (static or browser).</li>
 *   <li>Extract with {@link ExtractionRules} and accumulate in page order.</li>
 *   <li>Pause with the {@link DelayPolicy} before the next task.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>{@link NetworkException}: logged with the task and the page is skipped. The fetcher's own
 *       bounded retry is the only retry layer.</li>
 *   <li>{@link DriverException}: the crawl moves to {@link CrawlState#FAILED} and the error is rethrown.</li>
 * </ul>
 * Records are deduplicated by natural key and dropped when their capture timestamp is before the
 * crawl start or in the future. Not thread-safe; one instance runs one crawl at a time.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class CrawlOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(CrawlOrchestrator.class);

    private final PageFetcherInterface fetcher;
    private final ExtractionRules rules;
    private final DelayPolicy delayPolicy;
    private final Clock clock;
    private final CancellationToken cancellation;
    private CrawlState state = CrawlState.IDLE;

    public CrawlOrchestrator(PageFetcherInterface fetcher, ExtractionRules rules, DelayPolicy delayPolicy,
                             Clock clock, CancellationToken cancellation) {
        this.fetcher = fetcher;
        this.rules = rules;
        this.delayPolicy = delayPolicy;
        this.clock = clock;
        this.cancellation = cancellation;
    }

    /**
     * Crawls {@code maxPages} listing pages of every category, categories in the given order.
     */
    public CrawlResult<ExtractedRecord> crawlListings(String baseUrl, List<String> categories, int maxPages)
            throws DriverException {
        List<FetchTask> tasks = new ArrayList<>();
        for (String category : categories) {
            for (int page = 1; page <= maxPages; page++) {
                tasks.add(new FetchTask(category, page, listingUrl(baseUrl, category, page)));
            }
        }
        logger.info("Starting listing crawl: {} categories x {} pages", categories.size(), maxPages);
        return crawl(tasks, rules::extractListings, ExtractedRecord::naturalKey, ExtractedRecord::capturedAt);
    }

    /**
     * Crawls review pages, keeping at most {@code maxReviewsPerPage} reviews from each.
     */
    public CrawlResult<ReviewRecord> crawlReviews(List<String> urls, int maxReviewsPerPage) throws DriverException {
        List<FetchTask> tasks = new ArrayList<>();
        for (String url : urls) {
            tasks.add(FetchTask.forUrl(url));
        }
        logger.info("Starting review crawl over {} pages", urls.size());
        return crawl(tasks,
            (document, context) -> rules.extractReviews(document, context, maxReviewsPerPage),
            ReviewRecord::naturalKey, ReviewRecord::capturedAt);
    }

    public CrawlState state() {
        return state;
    }

    static String listingUrl(String baseUrl, String category, int page) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/category/" + URLEncoder.encode(category, StandardCharsets.UTF_8) + "?page=" + page;
    }

    private <T> CrawlResult<T> crawl(List<FetchTask> tasks,
                                     BiFunction<Document, ExtractionContext, List<T>> extractor,
                                     Function<T, String> naturalKey,
                                     Function<T, Instant> timestamp) throws DriverException {
        Instant startedAt = clock.instant();
        RecordDeduplicator<T> accumulator = new RecordDeduplicator<>(naturalKey);
        int fetched = 0;
        int failed = 0;
        int outOfRange = 0;
        boolean cancelled = false;

        for (int i = 0; i < tasks.size(); i++) {
            FetchTask task = tasks.get(i);
            if (cancellation.isCancelled()) {
                logger.warn("Crawl cancelled before {}", task);
                cancelled = true;
                break;
            }
            transition(CrawlState.PAGINATING);
            transition(CrawlState.FETCHING);
            Document document;
            try {
                document = fetcher.fetch(task);
            } catch (NetworkException e) {
                failed++;
                logger.warn("Skipping page (category={}, page={}, url={}, attempts={}): {}",
                    task.category(), task.page(), task.url(), task.attempts(), e.getMessage());
                paceBefore(i + 1, tasks.size());
                continue;
            } catch (DriverException e) {
                transition(CrawlState.FAILED);
                logger.error("Browser failure at {}: {}", task, e.getMessage());
                throw e;
            }
            fetched++;

            transition(CrawlState.EXTRACTING);
            List<T> extracted = extractor.apply(document, ExtractionContext.of(task, clock.instant()));

            transition(CrawlState.ACCUMULATING);
            Instant now = clock.instant();
            int added = 0;
            for (T record : extracted) {
                Instant capturedAt = timestamp.apply(record);
                if (capturedAt == null || capturedAt.isBefore(startedAt) || capturedAt.isAfter(now)) {
                    outOfRange++;
                    logger.warn("Dropping record with capture time {} outside [{}, {}] from {}", capturedAt, startedAt, now, task.url());
                    continue;
                }
                if (accumulator.add(record)) {
                    added++;
                }
            }
            logger.info("{} page {} -> {} records ({} new)", task.category().isEmpty() ? task.url() : task.category(),
                task.page(), extracted.size(), added);
            paceBefore(i + 1, tasks.size());
        }

        transition(cancelled ? CrawlState.CANCELLED : CrawlState.DONE);
        List<T> records = accumulator.records();
        logger.info("Crawl {}: {} records, {} pages fetched, {} pages failed",
            state.name().toLowerCase(), records.size(), fetched, failed);
        return new CrawlResult<>(records, fetched, failed, accumulator.duplicates() + outOfRange, cancelled);
    }

    private void paceBefore(int nextIndex, int taskCount) {
        if (nextIndex < taskCount && !cancellation.isCancelled()) {
            delayPolicy.pause();
        }
    }

    private void transition(CrawlState next) {
        logger.debug("Crawl state {} -> {}", state, next);
        state = next;
    }
}
