package com.ecommercedata.scraper;

import java.time.Duration;

/**
 * Retry decisions for {@link RetryingHttpClient}, kept apart from the sleeping so they can be
 * tested without real time passing.
 * <p>
 * The delay before attempt {@code n + 1} is a {@link DelayPolicy} draw doubled for every
 * failed attempt after the first, capped at {@code maxBackoff}.
 */
public final class BackoffPolicy {
    private final DelayPolicy delayPolicy;
    private final int maxAttempts;
    private final Duration maxBackoff;

    public BackoffPolicy(DelayPolicy delayPolicy, int maxAttempts, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.delayPolicy = delayPolicy;
        this.maxAttempts = maxAttempts;
        this.maxBackoff = maxBackoff;
    }

    /**
     * @param attempt number of attempts made so far (1 after the first failure)
     */
    public Duration nextDelay(int attempt) {
        int doublings = Math.max(0, Math.min(attempt - 1, 16));
        Duration delay = delayPolicy.nextDelay().multipliedBy(1L << doublings);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    /**
     * @param error   failure of the attempt that just finished
     * @param attempt number of attempts made so far
     */
    public boolean shouldRetry(NetworkException error, int attempt) {
        return error.isRetryable() && attempt < maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Sleeps for {@code delay} using the wrapped policy's sleeper.
     */
    void sleep(Duration delay) {
        delayPolicy.sleep(delay);
    }
}
