package com.ecommercedata.storage;

import com.ecommercedata.scraper.ExtractedRecord;
import com.ecommercedata.scraper.ReviewRecord;
import com.ecommercedata.sources.SocialMention;
import com.ecommercedata.sources.WeatherObservation;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column layouts of the pipeline's datasets, and conversion of JSON arrays into tables.
 */
public final class RecordTables {
    public static final List<String> PRODUCT_COLUMNS = List.of(
        "name", "price", "rating", "image_url", "product_url", "category", "source", "listing_url", "page", "scraped_at");
    public static final List<String> REVIEW_COLUMNS = List.of(
        "product_url", "reviewer_name", "rating", "review_text", "review_date", "scraped_at");
    public static final List<String> MENTION_COLUMNS = List.of(
        "platform", "title", "content", "score", "comments", "created_at", "subreddit", "author", "url", "keyword", "scraped_at");
    public static final List<String> WEATHER_COLUMNS = List.of(
        "city", "temperature", "humidity", "weather", "timestamp");

    private RecordTables() {}

    public static TableData products(List<ExtractedRecord> records) {
        TableData.Builder table = TableData.builder(PRODUCT_COLUMNS);
        for (ExtractedRecord r : records) {
            table.row(r.name(), r.price(), r.rating(), r.imageRef(), r.productUrl(), r.category(),
                r.sourceTag(), r.listingUrl(), r.page(), r.capturedAt());
        }
        return table.build();
    }

    public static TableData reviews(List<ReviewRecord> records) {
        TableData.Builder table = TableData.builder(REVIEW_COLUMNS);
        for (ReviewRecord r : records) {
            table.row(r.productUrl(), r.reviewerName(), r.rating(), r.text(), r.reviewDate(), r.capturedAt());
        }
        return table.build();
    }

    public static TableData mentions(List<SocialMention> mentions) {
        TableData.Builder table = TableData.builder(MENTION_COLUMNS);
        for (SocialMention m : mentions) {
            table.row(m.platform(), m.title(), m.content(), m.score(), m.comments(), m.createdAt(),
                m.subreddit(), m.author(), m.url(), m.keyword(), m.capturedAt());
        }
        return table.build();
    }

    public static TableData weather(List<WeatherObservation> observations) {
        TableData.Builder table = TableData.builder(WEATHER_COLUMNS);
        for (WeatherObservation w : observations) {
            table.row(w.city(), w.temperature(), w.humidity(), w.weather(), w.timestamp());
        }
        return table.build();
    }

    /**
     * Table of a JSON array of objects. Nested objects are flattened into {@code parent_child}
     * columns, arrays are kept as JSON text, and columns appear in first-seen order.
     */
    public static TableData fromJsonArray(JsonNode array) {
        List<Map<String, Object>> flattened = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        for (JsonNode element : array) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (element.isObject()) {
                flatten("", element, row);
            } else {
                row.put("value", scalar(element));
            }
            columns.addAll(row.keySet());
            flattened.add(row);
        }
        TableData.Builder table = TableData.builder(new ArrayList<>(columns));
        for (Map<String, Object> row : flattened) {
            List<Object> values = new ArrayList<>(columns.size());
            for (String column : columns) {
                values.add(row.get(column));
            }
            table.row(values);
        }
        return table.build();
    }

    private static void flatten(String prefix, JsonNode node, Map<String, Object> row) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = prefix.isEmpty() ? field.getKey() : prefix + "_" + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                flatten(name, value, row);
            } else {
                row.put(name, scalar(value));
            }
        }
    }

    private static Object scalar(JsonNode value) {
        if (value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }
}
