package com.ecommercedata.sources;

import com.ecommercedata.scraper.DelayPolicy;
import com.ecommercedata.scraper.JsonSupport;
import com.ecommercedata.scraper.MarkupParseException;
import com.ecommercedata.scraper.NetworkException;
import com.ecommercedata.scraper.RetryingHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the current-weather JSON API, one request per city in metric units.
 * <p>
 * Without an API key no request is made.
 */
public class WeatherClient {
    private static final Logger logger = LoggerFactory.getLogger(WeatherClient.class);

    private final RetryingHttpClient client;
    private final DelayPolicy delayPolicy;
    private final String endpoint;
    private final String apiKey;
    private final Clock clock;

    public WeatherClient(RetryingHttpClient client, DelayPolicy delayPolicy, String endpoint, String apiKey, Clock clock) {
        this.client = client;
        this.delayPolicy = delayPolicy;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.clock = clock;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public List<WeatherObservation> fetch(List<String> cities) {
        List<WeatherObservation> observations = new ArrayList<>();
        if (!isConfigured()) {
            logger.warn("No weather API key configured; skipping weather for {} cities", cities.size());
            return observations;
        }
        for (int i = 0; i < cities.size(); i++) {
            String city = cities.get(i);
            String url = endpoint + "?q=" + URLEncoder.encode(city, StandardCharsets.UTF_8)
                + "&appid=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8) + "&units=metric";
            try {
                observations.add(parse(client.get(url), city));
            } catch (NetworkException | MarkupParseException e) {
                // the key is part of the URL, so only the city is logged
                logger.warn("Skipping weather for {}: {}", city, e.getMessage().replace(apiKey, "***"));
            }
            if (i < cities.size() - 1) {
                delayPolicy.pause();
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
        }
        logger.info("Collected weather for {} of {} cities", observations.size(), cities.size());
        return observations;
    }

    WeatherObservation parse(String body, String city) throws MarkupParseException {
        JsonNode json = JsonSupport.parse(body, "weather API (" + city + ")");
        JsonNode main = json.path("main");
        if (!main.has("temp")) {
            throw new MarkupParseException("Weather response for " + city + " has no main.temp");
        }
        JsonNode conditions = json.path("weather");
        String weather = conditions.isArray() && conditions.size() > 0 ? conditions.get(0).path("main").asText("") : "";
        return new WeatherObservation(
            json.path("name").asText(city),
            main.path("temp").asDouble(),
            main.path("humidity").asInt(),
            weather,
            clock.instant());
    }
}
