package com.ecommercedata.scraper;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings of one pipeline run, as resolved by {@link ConfigLoader}.
 */
public record PipelineConfig(
    boolean headless,
    double delayMinSeconds,
    double delayMaxSeconds,
    Long randomSeed,
    int maxAttempts,
    Duration requestTimeout,
    Duration markerTimeout,
    Duration maxBackoff,
    List<String> userAgents,
    String listingBaseUrl,
    List<String> categories,
    int maxPages,
    List<String> reviewUrls,
    int maxReviewsPerPage,
    String socialEndpoint,
    List<String> socialKeywords,
    String catalogBaseUrl,
    String weatherEndpoint,
    String weatherApiKey,
    List<String> weatherCities,
    Path outputDir,
    DatabaseConfig database,
    int embeddedPort,
    Path embeddedDataDir
) {
    public PipelineConfig {
        userAgents = List.copyOf(userAgents);
        categories = List.copyOf(categories);
        reviewUrls = List.copyOf(reviewUrls);
        socialKeywords = List.copyOf(socialKeywords);
        weatherCities = List.copyOf(weatherCities);
    }

    /**
     * Connection descriptor of an external database. Blank URL means "use the embedded one".
     */
    public record DatabaseConfig(String jdbcUrl, String user, String password) {
        public boolean isConfigured() {
            return jdbcUrl != null && !jdbcUrl.isBlank();
        }

        @Override
        public String toString() {
            return "DatabaseConfig[jdbcUrl=" + jdbcUrl + ", user=" + user + "]";
        }
    }

    /** Directory for scraped and API datasets. */
    public Path externalDataDir() {
        return outputDir.resolve("raw").resolve("external");
    }

    /** Directory of the generated internal datasets. */
    public Path internalDataDir() {
        return outputDir.resolve("raw").resolve("internal");
    }

    public BrowserSettings browserSettings() {
        return new BrowserSettings(headless, requestTimeout, markerTimeout, userAgents.get(0));
    }
}
