package com.ecommercedata.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson setup: java.time support, ISO-8601 dates instead of epoch numbers.
 */
public final class JsonSupport {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonSupport() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses an API response body.
     *
     * @param source URL or file the body came from, for the error message
     * @throws MarkupParseException when the body is not JSON
     */
    public static JsonNode parse(String body, String source) throws MarkupParseException {
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarkupParseException("Response from " + source + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
