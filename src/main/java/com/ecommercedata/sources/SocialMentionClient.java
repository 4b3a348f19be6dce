package com.ecommercedata.sources;

import com.ecommercedata.scraper.DelayPolicy;
import com.ecommercedata.scraper.JsonSupport;
import com.ecommercedata.scraper.MarkupParseException;
import com.ecommercedata.scraper.NetworkException;
import com.ecommercedata.scraper.RecordDeduplicator;
import com.ecommercedata.scraper.RetryingHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the social search JSON endpoint ({@code /search.json}).
 * <p>
 * One request per keyword, paced with the {@link DelayPolicy}. A keyword whose request or payload
 * fails is logged and skipped; the others still count.
 */
public class SocialMentionClient {
    private static final Logger logger = LoggerFactory.getLogger(SocialMentionClient.class);

    static final String PLATFORM = "reddit";
    static final int PAGE_SIZE = 25;

    private final RetryingHttpClient client;
    private final DelayPolicy delayPolicy;
    private final String endpoint;
    private final Clock clock;

    public SocialMentionClient(RetryingHttpClient client, DelayPolicy delayPolicy, String endpoint, Clock clock) {
        this.client = client;
        this.delayPolicy = delayPolicy;
        this.endpoint = endpoint;
        this.clock = clock;
    }

    /**
     * Newest posts for every keyword, deduplicated by post link and keyword.
     */
    public List<SocialMention> search(List<String> keywords) {
        RecordDeduplicator<SocialMention> mentions = new RecordDeduplicator<>(SocialMention::naturalKey);
        for (int i = 0; i < keywords.size(); i++) {
            String keyword = keywords.get(i);
            String url = searchUrl(keyword);
            try {
                List<SocialMention> found = parse(client.get(url), keyword, url);
                found.forEach(mentions::add);
                logger.info("Collected {} posts for keyword '{}'", found.size(), keyword);
            } catch (NetworkException | MarkupParseException e) {
                logger.warn("Skipping keyword '{}' ({}): {}", keyword, url, e.getMessage());
            }
            if (i < keywords.size() - 1) {
                delayPolicy.pause();
                if (Thread.currentThread().isInterrupted()) {
                    logger.warn("Social search interrupted after keyword '{}'", keyword);
                    break;
                }
            }
        }
        return mentions.records();
    }

    String searchUrl(String keyword) {
        return endpoint + "?q=" + URLEncoder.encode(keyword, StandardCharsets.UTF_8) + "&sort=new&limit=" + PAGE_SIZE;
    }

    List<SocialMention> parse(String body, String keyword, String url) throws MarkupParseException {
        JsonNode children = JsonSupport.parse(body, url).path("data").path("children");
        if (!children.isArray()) {
            throw new MarkupParseException("No data.children array in response from " + url);
        }
        Instant capturedAt = clock.instant();
        List<SocialMention> mentions = new ArrayList<>();
        for (JsonNode child : children) {
            JsonNode post = child.path("data");
            if (!post.isObject()) {
                logger.debug("Skipping child without data object for keyword '{}'", keyword);
                continue;
            }
            mentions.add(new SocialMention(
                PLATFORM,
                post.path("title").asText(""),
                post.path("selftext").asText(""),
                post.path("score").asLong(0),
                post.path("num_comments").asLong(0),
                Instant.ofEpochMilli(Math.round(post.path("created_utc").asDouble(0) * 1000)),
                post.path("subreddit").asText(""),
                post.path("author").asText(""),
                permalink(post.path("permalink").asText("")),
                keyword,
                capturedAt));
        }
        return mentions;
    }

    private String permalink(String path) {
        if (path.isEmpty()) {
            return "";
        }
        try {
            return URI.create(endpoint).resolve(path).toString();
        } catch (IllegalArgumentException e) {
            logger.debug("Permalink '{}' is not a valid URI path ({}); joining it as text", path, e.getMessage());
            return origin() + (path.startsWith("/") ? path : "/" + path);
        }
    }

    /**
     * Scheme and host of the endpoint, e.g. {@code https://www.reddit.com}.
     */
    private String origin() {
        int scheme = endpoint.indexOf("://");
        int slash = scheme < 0 ? -1 : endpoint.indexOf('/', scheme + 3);
        return slash < 0 ? endpoint : endpoint.substring(0, slash);
    }
}
