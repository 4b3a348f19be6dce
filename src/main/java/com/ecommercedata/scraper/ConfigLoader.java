package com.ecommercedata.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Resolves {@link PipelineConfig} from classpath defaults and the environment.
 * <p>
 * Every key of {@code pipeline.properties} can be overridden by a system property or an
 * environment variable. Both are looked up under the key itself and under its upper-case form
 * with dots and hyphens replaced by underscores, e.g. {@code scraper.delay.min} and
 * {@code SCRAPER_DELAY_MIN}. Lists are comma separated, except the user agents which are
 * separated by {@code |}.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "/pipeline.properties";

    private final Function<String, String> environment;
    private final Function<String, String> systemProperties;
    private final Properties defaults;

    public ConfigLoader(Function<String, String> environment, Function<String, String> systemProperties, Properties defaults) {
        this.environment = environment;
        this.systemProperties = systemProperties;
        this.defaults = defaults;
    }

    /**
     * Loader over the real environment, system properties and the bundled defaults.
     */
    public static ConfigLoader fromEnvironment() {
        return new ConfigLoader(System::getenv, System::getProperty, classpathDefaults());
    }

    static Properties classpathDefaults() {
        Properties properties = new Properties();
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("{} not found on the classpath; using built-in values only", DEFAULTS_RESOURCE);
                return properties;
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULTS_RESOURCE, e);
        }
        return properties;
    }

    /**
     * @throws IllegalArgumentException when a value is unparsable or out of range
     */
    public PipelineConfig load() {
        double delayMin = decimal("scraper.delay.min", "1");
        double delayMax = decimal("scraper.delay.max", "3");
        if (delayMin < 0 || delayMax < delayMin) {
            throw new IllegalArgumentException("Invalid delay range: min=" + delayMin + ", max=" + delayMax);
        }
        int maxAttempts = positive("scraper.max-retries", "3");
        List<String> userAgents = list("scraper.user-agents", "", "\\|");
        if (userAgents.isEmpty()) {
            throw new IllegalArgumentException("scraper.user-agents must name at least one user agent");
        }
        String seed = get("scraper.delay.seed", "");
        String weatherKey = get("weather.api-key", "");
        if (weatherKey.isBlank()) {
            weatherKey = firstNonNull(environment.apply("OPENWEATHER_API_KEY"), "");
        }

        PipelineConfig config = new PipelineConfig(
            Boolean.parseBoolean(get("scraper.headless", "true")),
            delayMin,
            delayMax,
            seed.isBlank() ? null : parseLong("scraper.delay.seed", seed),
            maxAttempts,
            Duration.ofSeconds(positive("scraper.timeout.seconds", "30")),
            Duration.ofSeconds(positive("scraper.marker-timeout.seconds", "10")),
            Duration.ofSeconds(positive("scraper.max-backoff.seconds", "30")),
            userAgents,
            get("listings.base-url", ""),
            list("listings.categories", "", ","),
            positive("listings.max-pages", "3"),
            list("reviews.urls", "", ","),
            positive("reviews.max-per-page", "50"),
            get("social.endpoint", "https://www.reddit.com/search.json"),
            list("social.keywords", "", ","),
            get("catalog.base-url", "https://fakestoreapi.com"),
            get("weather.endpoint", "http://api.openweathermap.org/data/2.5/weather"),
            weatherKey,
            list("weather.cities", "", ","),
            Path.of(get("output.dir", "data")),
            new PipelineConfig.DatabaseConfig(get("db.url", ""), get("db.user", "postgres"), get("db.password", "")),
            positive("embedded-pg.port", "5432"),
            Path.of(get("embedded-pg.data-dir", "data/pgdata")));
        logger.info("Configuration loaded: delay {}-{} s, {} attempts, {} categories, {} keywords, database {}",
            delayMin, delayMax, maxAttempts, config.categories().size(), config.socialKeywords().size(),
            config.database().isConfigured() ? config.database().jdbcUrl() : "embedded");
        return config;
    }

    static String toEnvKey(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    String get(String key, String fallback) {
        String envKey = toEnvKey(key);
        String value = firstNonNull(systemProperties.apply(key), systemProperties.apply(envKey), environment.apply(envKey));
        if (value == null) {
            value = defaults.getProperty(key, fallback);
        }
        return value.trim();
    }

    private List<String> list(String key, String fallback, String separator) {
        List<String> values = new ArrayList<>();
        for (String part : get(key, fallback).split(separator)) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }

    private double decimal(String key, String fallback) {
        String value = get(key, fallback);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: '" + value + "'", e);
        }
    }

    private int positive(String key, String fallback) {
        long value = parseLong(key, get(key, fallback));
        if (value < 1 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " must be a positive integer, was " + value);
        }
        return (int) value;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
