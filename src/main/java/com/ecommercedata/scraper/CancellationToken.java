package com.ecommercedata.scraper;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and a running crawl.
 * Checked at every page and stage boundary; cancelling never interrupts a request in flight.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A token nobody cancels. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * @return true once {@link #cancel()} was called or the current thread was interrupted
     */
    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }
}
