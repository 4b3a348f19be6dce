package com.ecommercedata.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for randomized request pacing.
 */
public class DelayPolicyTest {

    @Test
    void testPauseStaysWithinBoundsOverManySamples() {
        RecordingSleeper sleeper = new RecordingSleeper();
        DelayPolicy policy = new DelayPolicy(1.0, 3.0, new Random(7), sleeper);
        for (int i = 0; i < 10_000; i++) {
            policy.pause();
        }
        assertEquals(10_000, sleeper.count());
        Duration min = Duration.ofSeconds(1);
        Duration max = Duration.ofSeconds(3);
        for (Duration d : sleeper.sleeps()) {
            assertTrue(d.compareTo(min) >= 0 && d.compareTo(max) <= 0, "delay out of range: " + d);
        }
    }

    @Test
    void testSameSeedGivesSameSequence() {
        DelayPolicy first = new DelayPolicy(0.5, 2.5, new Random(42), new RecordingSleeper());
        DelayPolicy second = new DelayPolicy(0.5, 2.5, new Random(42), new RecordingSleeper());
        for (int i = 0; i < 100; i++) {
            assertEquals(first.nextDelay(), second.nextDelay());
        }
    }

    @Test
    void testFixedRangeAlwaysReturnsThatValue() {
        DelayPolicy policy = new DelayPolicy(2.0, 2.0, new Random(1), new RecordingSleeper());
        assertEquals(Duration.ofSeconds(2), policy.nextDelay());
    }

    @Test
    void testInvalidRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DelayPolicy(3.0, 1.0, new Random(), new RecordingSleeper()));
        assertThrows(IllegalArgumentException.class, () -> new DelayPolicy(-1.0, 1.0, new Random(), new RecordingSleeper()));
    }

    @Test
    void testInterruptedPauseKeepsInterruptFlag() {
        DelayPolicy policy = new DelayPolicy(1.0, 1.0, new Random(), d -> {
            throw new InterruptedException("stop");
        });
        try {
            policy.pause();
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
