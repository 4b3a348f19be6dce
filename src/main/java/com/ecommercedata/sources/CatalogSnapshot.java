package com.ecommercedata.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Raw JSON arrays of the sample catalog, keyed by resource name ({@code products}, {@code users},
 * {@code carts}). Resources that could not be fetched are absent.
 */
public record CatalogSnapshot(Map<String, ArrayNode> resources) {
    public CatalogSnapshot {
        resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }

    public Optional<ArrayNode> resource(String name) {
        return Optional.ofNullable(resources.get(name));
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    /**
     * The snapshot as one JSON object, the layout of {@code fake_store_data.json}.
     */
    public Map<String, JsonNode> asJson() {
        return new LinkedHashMap<>(resources);
    }
}
