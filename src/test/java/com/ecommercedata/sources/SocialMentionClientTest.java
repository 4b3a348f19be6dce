package com.ecommercedata.sources;

import com.ecommercedata.scraper.BackoffPolicy;
import com.ecommercedata.scraper.DelayPolicy;
import com.ecommercedata.scraper.Fixtures;
import com.ecommercedata.scraper.MarkupParseException;
import com.ecommercedata.scraper.RecordingSleeper;
import com.ecommercedata.scraper.RetryingHttpClient;
import com.ecommercedata.scraper.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SocialMentionClientTest {
    private static final String ENDPOINT = "https://www.reddit.com/search.json";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private ScriptedTransport transport;
    private RecordingSleeper sleeper;
    private SocialMentionClient client;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        sleeper = new RecordingSleeper();
        DelayPolicy delay = new DelayPolicy(1.0, 2.0, new Random(3), sleeper);
        RetryingHttpClient http = new RetryingHttpClient(transport,
            new BackoffPolicy(delay, 3, Duration.ofSeconds(30)), Duration.ofSeconds(10));
        client = new SocialMentionClient(http, delay, ENDPOINT, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testSearchUrlEncodesKeyword() {
        assertEquals(ENDPOINT + "?q=ecommerce+trends&sort=new&limit=25", client.searchUrl("ecommerce trends"));
    }

    @Test
    void testParseMapsPostFields() throws Exception {
        List<SocialMention> mentions = client.parse(Fixtures.read("reddit-search.json"), "ecommerce", ENDPOINT);

        assertEquals(2, mentions.size());
        SocialMention first = mentions.get(0);
        assertEquals("reddit", first.platform());
        assertEquals("Best ecommerce platforms in 2024?", first.title());
        assertEquals("Looking for recommendations for a small store.", first.content());
        assertEquals(42, first.score());
        assertEquals(17, first.comments());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), first.createdAt());
        assertEquals("ecommerce", first.subreddit());
        assertEquals("shopkeeper", first.author());
        assertEquals("https://www.reddit.com/r/ecommerce/comments/abc123/best_ecommerce_platforms/", first.url());
        assertEquals("ecommerce", first.keyword());
        assertEquals(NOW, first.capturedAt());
        assertEquals(Instant.parse("2024-01-02T00:00:00.500Z"), mentions.get(1).createdAt());
        assertEquals("", mentions.get(1).content());
    }

    @Test
    void testParseRejectsPayloadWithoutChildren() {
        assertThrows(MarkupParseException.class, () -> client.parse("{\"data\":{}}", "x", ENDPOINT));
        assertThrows(MarkupParseException.class, () -> client.parse("not json", "x", ENDPOINT));
    }

    @Test
    void testSearchSkipsFailingKeywordAndPacesBetweenKeywords() {
        String body = Fixtures.read("reddit-search.json");
        transport.respond(client.searchUrl("ecommerce"), 200, body);
        transport.respond(client.searchUrl("broken"), 200, "<html>maintenance</html>");
        transport.respond(client.searchUrl("retail"), 200, body);

        List<SocialMention> mentions = client.search(List.of("ecommerce", "broken", "missing", "retail"));

        assertEquals(4, mentions.size());
        assertEquals("ecommerce", mentions.get(0).keyword());
        assertEquals("retail", mentions.get(3).keyword());
        assertEquals(4, transport.requests().size());
        assertEquals(3, sleeper.count());
    }

    @Test
    void testRepeatedKeywordIsDeduplicated() {
        transport.respond(client.searchUrl("ecommerce"), 200, Fixtures.read("reddit-search.json"));
        List<SocialMention> mentions = client.search(List.of("ecommerce", "ecommerce"));
        assertEquals(2, mentions.size());
        assertEquals(2, transport.requestsTo(client.searchUrl("ecommerce")));
    }

    @Test
    void testMalformedPermalinkIsJoinedAsText() {
        String odd = "{\"data\":{\"children\":[{\"data\":{\"title\":\"Deals\",\"score\":1,"
            + "\"permalink\":\"/r/deals/comments/1/50% off now/\"}}]}}";
        transport.respond(client.searchUrl("bad"), 200, odd);
        transport.respond(client.searchUrl("ecommerce"), 200, Fixtures.read("reddit-search.json"));

        List<SocialMention> mentions = client.search(List.of("bad", "ecommerce"));

        assertEquals(3, mentions.size());
        assertEquals("https://www.reddit.com/r/deals/comments/1/50% off now/", mentions.get(0).url());
        assertEquals("bad", mentions.get(0).keyword());
        assertEquals("ecommerce", mentions.get(1).keyword());
    }
}
