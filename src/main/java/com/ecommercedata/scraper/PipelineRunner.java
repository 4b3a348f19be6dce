package com.ecommercedata.scraper;

import com.ecommercedata.sources.CatalogSnapshot;
import com.ecommercedata.sources.ProductCatalogClient;
import com.ecommercedata.sources.SocialMention;
import com.ecommercedata.sources.SocialMentionClient;
import com.ecommercedata.sources.WeatherClient;
import com.ecommercedata.sources.WeatherObservation;
import com.ecommercedata.storage.DatasetWriterInterface;
import com.ecommercedata.storage.LoadResult;
import com.ecommercedata.storage.RecordTables;
import com.ecommercedata.storage.TableData;
import com.ecommercedata.storage.TabularLoaderInterface;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs every collection stage in order and lands each dataset in files and in the store.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Competitor listings: static crawl of {@code {base}/category/{category}?page={n}}.</li>
 *   <li>Competitor reviews: browser crawl of the configured review pages.</li>
 *   <li>Social mentions, sample catalog and weather from their JSON APIs.</li>
 *   <li>Each non-empty dataset is written as CSV and JSON, then fully replaces its table.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>A browser failure fails the review dataset only; the other stages still run.</li>
 *   <li>A load failure fails that table only.</li>
 *   <li>After cancellation no further stage starts and the interrupted crawl is not loaded.</li>
 * </ul>
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class PipelineRunner {
    private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

    public static final String PRODUCTS_TABLE = "competitor_products";
    public static final String REVIEWS_TABLE = "competitor_reviews";
    public static final String MENTIONS_TABLE = "social_mentions";
    public static final String CATALOG_TABLE_PREFIX = "catalog_";
    public static final String WEATHER_TABLE = "weather_data";
    public static final String CATALOG_SNAPSHOT_FILE = "fake_store_data.json";

    private final PipelineConfig config;
    private final SiteProfile profile;
    private final HttpTransport transport;
    private final DynamicSessionFactory sessionFactory;
    private final TabularLoaderInterface loader;
    private final DatasetWriterInterface writer;
    private final Clock clock;
    private final DelayPolicy.Sleeper sleeper;
    private final CancellationToken cancellation;

    public PipelineRunner(PipelineConfig config, SiteProfile profile, HttpTransport transport,
                          DynamicSessionFactory sessionFactory, TabularLoaderInterface loader,
                          DatasetWriterInterface writer, Clock clock, DelayPolicy.Sleeper sleeper,
                          CancellationToken cancellation) {
        this.config = config;
        this.profile = profile;
        this.transport = transport;
        this.sessionFactory = sessionFactory;
        this.loader = loader;
        this.writer = writer;
        this.clock = clock;
        this.sleeper = sleeper;
        this.cancellation = cancellation;
    }

    public PipelineSummary run() {
        PipelineSummary summary = new PipelineSummary();
        Random random = config.randomSeed() == null ? new Random() : new Random(config.randomSeed());
        DelayPolicy delayPolicy = new DelayPolicy(config.delayMinSeconds(), config.delayMaxSeconds(), random, sleeper);
        RetryingHttpClient http = new RetryingHttpClient(transport,
            new BackoffPolicy(delayPolicy, config.maxAttempts(), config.maxBackoff()), config.requestTimeout());
        ExtractionRules rules = new ExtractionRules(profile);

        logger.info("Pipeline run started; output under {}", config.outputDir());
        collectListings(summary, http, rules, delayPolicy);
        if (proceed(summary, "reviews")) {
            collectReviews(summary, rules, delayPolicy);
        }
        if (proceed(summary, "social mentions")) {
            List<SocialMention> mentions = new SocialMentionClient(http, delayPolicy, config.socialEndpoint(), clock)
                .search(config.socialKeywords());
            publish(summary, MENTIONS_TABLE, RecordTables.mentions(mentions));
        }
        if (proceed(summary, "catalog")) {
            collectCatalog(summary, http, delayPolicy);
        }
        if (proceed(summary, "weather")) {
            WeatherClient weather = new WeatherClient(http, delayPolicy, config.weatherEndpoint(), config.weatherApiKey(), clock);
            List<WeatherObservation> observations = weather.fetch(config.weatherCities());
            publish(summary, WEATHER_TABLE, RecordTables.weather(observations));
        }
        logger.info("Pipeline run finished: {} tables loaded, {} failures{}",
            summary.loads().size(), summary.failures().size(), summary.cancelled() ? " (cancelled)" : "");
        return summary;
    }

    private void collectListings(PipelineSummary summary, RetryingHttpClient http, ExtractionRules rules,
                                 DelayPolicy delayPolicy) {
        if (config.listingBaseUrl().isBlank() || config.categories().isEmpty()) {
            logger.info("No listing site configured; skipping competitor listings");
            return;
        }
        CrawlOrchestrator orchestrator = new CrawlOrchestrator(new StaticFetcher(http), rules, delayPolicy, clock, cancellation);
        try {
            CrawlResult<ExtractedRecord> result = orchestrator.crawlListings(
                config.listingBaseUrl(), config.categories(), config.maxPages());
            summary.crawled(PRODUCTS_TABLE, result);
            if (!result.cancelled()) {
                publish(summary, PRODUCTS_TABLE, RecordTables.products(result.records()));
            }
        } catch (DriverException e) {
            logger.error("Listing crawl failed: {}", e.getMessage());
            summary.failed(PRODUCTS_TABLE, e);
        }
    }

    private void collectReviews(PipelineSummary summary, ExtractionRules rules, DelayPolicy delayPolicy) {
        if (config.reviewUrls().isEmpty()) {
            logger.info("No review pages configured; skipping the browser pass");
            return;
        }
        try (DynamicSessionInterface session = sessionFactory.open(config.browserSettings())) {
            CrawlOrchestrator orchestrator = new CrawlOrchestrator(
                new DynamicFetcher(session, profile.markerSelector()), rules, delayPolicy, clock, cancellation);
            CrawlResult<ReviewRecord> result = orchestrator.crawlReviews(config.reviewUrls(), config.maxReviewsPerPage());
            summary.crawled(REVIEWS_TABLE, result);
            if (!result.cancelled()) {
                publish(summary, REVIEWS_TABLE, RecordTables.reviews(result.records()));
            }
        } catch (DriverException e) {
            logger.error("Browser pass failed, no reviews loaded: {}", e.getMessage());
            summary.failed(REVIEWS_TABLE, e);
        }
    }

    private void collectCatalog(PipelineSummary summary, RetryingHttpClient http, DelayPolicy delayPolicy) {
        CatalogSnapshot snapshot = new ProductCatalogClient(http, delayPolicy, config.catalogBaseUrl()).fetch();
        if (snapshot.isEmpty()) {
            logger.warn("Sample catalog returned nothing");
            return;
        }
        Path file = config.externalDataDir().resolve(CATALOG_SNAPSHOT_FILE);
        try {
            writer.writeJson(snapshot.asJson(), file);
            logger.info("Saved catalog snapshot to {}", file);
        } catch (IOException e) {
            logger.error("Could not write {}: {}", file, e.getMessage());
            summary.failed("catalog", "write", e.getMessage());
        }
        for (Map.Entry<String, ArrayNode> resource : snapshot.resources().entrySet()) {
            publish(summary, CATALOG_TABLE_PREFIX + resource.getKey(), RecordTables.fromJsonArray(resource.getValue()));
        }
    }

    private boolean proceed(PipelineSummary summary, String stage) {
        if (summary.cancelled() || cancellation.isCancelled()) {
            if (!summary.cancelled()) {
                logger.warn("Run cancelled before the {} stage", stage);
            }
            summary.markCancelled();
            return false;
        }
        return true;
    }

    private void publish(PipelineSummary summary, String table, TableData data) {
        if (data.rowCount() == 0) {
            logger.info("No rows for {}; table left unchanged", table);
            return;
        }
        try {
            writer.save(data, table, config.externalDataDir());
        } catch (IOException e) {
            logger.error("Could not write files for {}: {}", table, e.getMessage());
            summary.failed(table, "write", e.getMessage());
        }
        try {
            LoadResult result = loader.load(data, table);
            summary.loaded(result);
        } catch (LoadException e) {
            logger.error("Load of {} failed: {}", table, e.getMessage());
            summary.failed(table, e);
        }
    }
}
