package com.ecommercedata.sources;

import com.ecommercedata.scraper.DelayPolicy;
import com.ecommercedata.scraper.JsonSupport;
import com.ecommercedata.scraper.MarkupParseException;
import com.ecommercedata.scraper.NetworkException;
import com.ecommercedata.scraper.RetryingHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the public sample catalog API ({@code /products}, {@code /users}, {@code /carts}).
 */
public class ProductCatalogClient {
    private static final Logger logger = LoggerFactory.getLogger(ProductCatalogClient.class);

    public static final List<String> RESOURCES = List.of("products", "users", "carts");

    private final RetryingHttpClient client;
    private final DelayPolicy delayPolicy;
    private final String baseUrl;

    public ProductCatalogClient(RetryingHttpClient client, DelayPolicy delayPolicy, String baseUrl) {
        this.client = client;
        this.delayPolicy = delayPolicy;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Fetches every catalog resource. A resource that fails is logged and left out of the snapshot.
     */
    public CatalogSnapshot fetch() {
        Map<String, ArrayNode> resources = new LinkedHashMap<>();
        for (int i = 0; i < RESOURCES.size(); i++) {
            String resource = RESOURCES.get(i);
            String url = baseUrl + "/" + resource;
            try {
                JsonNode json = JsonSupport.parse(client.get(url), url);
                if (!json.isArray()) {
                    throw new MarkupParseException("Expected a JSON array from " + url);
                }
                resources.put(resource, (ArrayNode) json);
                logger.info("Fetched {} {} from the catalog", json.size(), resource);
            } catch (NetworkException | MarkupParseException e) {
                logger.warn("Skipping catalog resource {} ({}): {}", resource, url, e.getMessage());
            }
            if (i < RESOURCES.size() - 1) {
                delayPolicy.pause();
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
        }
        return new CatalogSnapshot(resources);
    }
}
