package com.ecommercedata.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Randomized pacing between outbound requests to the same host.
 * <p>
 * Each {@link #pause()} blocks for a duration drawn uniformly from [min, max] seconds.
 * The draw comes from the supplied {@link Random}, so a seeded instance yields the same
 * sequence of delays on every run, and the {@link Sleeper} lets tests observe delays
 * without waiting for them.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public final class DelayPolicy {
    private static final Logger logger = LoggerFactory.getLogger(DelayPolicy.class);

    /**
     * Blocks the calling thread. {@code Thread::sleep} in production.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;

        static Sleeper system() {
            return duration -> Thread.sleep(duration.toMillis());
        }
    }

    private final double minSeconds;
    private final double maxSeconds;
    private final Random random;
    private final Sleeper sleeper;

    public DelayPolicy(double minSeconds, double maxSeconds, Random random, Sleeper sleeper) {
        if (minSeconds < 0 || maxSeconds < minSeconds) {
            throw new IllegalArgumentException("Invalid delay range [" + minSeconds + ", " + maxSeconds + "]");
        }
        this.minSeconds = minSeconds;
        this.maxSeconds = maxSeconds;
        this.random = random == null ? new Random() : random;
        this.sleeper = sleeper == null ? Sleeper.system() : sleeper;
    }

    /**
     * Real-time policy; seeded when {@code seed} is non-null.
     */
    public static DelayPolicy of(double minSeconds, double maxSeconds, Long seed) {
        return new DelayPolicy(minSeconds, maxSeconds, seed == null ? new Random() : new Random(seed), Sleeper.system());
    }

    /**
     * Draws the next delay without sleeping.
     */
    public Duration nextDelay() {
        double seconds = minSeconds + random.nextDouble() * (maxSeconds - minSeconds);
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }

    /**
     * Sleeps for the next drawn delay. An interrupt ends the pause early and is left set on the
     * thread for the caller's cancellation check.
     *
     * @return the delay that was drawn
     */
    public Duration pause() {
        Duration delay = nextDelay();
        sleep(delay);
        return delay;
    }

    /**
     * Sleeps for an explicit duration through this policy's sleeper.
     */
    public void sleep(Duration delay) {
        try {
            logger.debug("Pausing for {} ms", delay.toMillis());
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            logger.warn("Pause interrupted after request pacing started; stopping early.");
            Thread.currentThread().interrupt();
        }
    }

    public double minSeconds() {
        return minSeconds;
    }

    public double maxSeconds() {
        return maxSeconds;
    }
}
