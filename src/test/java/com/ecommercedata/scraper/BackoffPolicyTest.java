package com.ecommercedata.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for retry decisions and backoff growth.
 */
public class BackoffPolicyTest {

    private static BackoffPolicy policy(int maxAttempts, Duration cap) {
        return new BackoffPolicy(new DelayPolicy(1.0, 1.0, new Random(3), new RecordingSleeper()), maxAttempts, cap);
    }

    @Test
    void testDelayDoublesPerAttemptUpToCap() {
        BackoffPolicy backoff = policy(5, Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(1), backoff.nextDelay(1));
        assertEquals(Duration.ofSeconds(2), backoff.nextDelay(2));
        assertEquals(Duration.ofSeconds(4), backoff.nextDelay(3));
        assertEquals(Duration.ofSeconds(5), backoff.nextDelay(4));
        assertEquals(Duration.ofSeconds(5), backoff.nextDelay(40));
    }

    @Test
    void testServerErrorsRetryUntilBudgetIsSpent() {
        BackoffPolicy backoff = policy(3, Duration.ofSeconds(30));
        NetworkException serverError = NetworkException.forStatus("http://shop.test", 503, 1);
        assertTrue(backoff.shouldRetry(serverError, 1));
        assertTrue(backoff.shouldRetry(serverError, 2));
        assertFalse(backoff.shouldRetry(serverError, 3));
    }

    @Test
    void testClientErrorsAreNeverRetried() {
        BackoffPolicy backoff = policy(3, Duration.ofSeconds(30));
        assertFalse(backoff.shouldRetry(NetworkException.forStatus("http://shop.test", 404, 1), 1));
        assertFalse(backoff.shouldRetry(NetworkException.forStatus("http://shop.test", 429, 1), 1));
    }

    @Test
    void testAtLeastOneAttemptRequired() {
        assertThrows(IllegalArgumentException.class, () -> policy(0, Duration.ofSeconds(1)));
    }
}
