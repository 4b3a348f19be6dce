package com.ecommercedata.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * GET with bounded retries, shared by the static page fetcher and the JSON API clients.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Sends the request through the {@link HttpTransport} with the configured timeout.</li>
 *   <li>2xx returns the body; 5xx, timeouts and connection failures are retried.</li>
 *   <li>Any other status fails at once without a retry.</li>
 *   <li>Waits with exponential backoff between attempts and stops once the attempt budget is spent.</li>
 * </ul>
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class RetryingHttpClient {
    private static final Logger logger = LoggerFactory.getLogger(RetryingHttpClient.class);

    private final HttpTransport transport;
    private final BackoffPolicy backoff;
    private final Duration timeout;

    public RetryingHttpClient(HttpTransport transport, BackoffPolicy backoff, Duration timeout) {
        this.transport = transport;
        this.backoff = backoff;
        this.timeout = timeout;
    }

    public String get(String url) throws NetworkException {
        return get(FetchTask.forUrl(url));
    }

    /**
     * Fetches the task's URL, counting every attempt on the task.
     *
     * @return response body of the first 2xx response
     * @throws NetworkException on a non-retryable status or once the attempts are used up
     */
    public String get(FetchTask task) throws NetworkException {
        while (true) {
            int attempt = task.recordAttempt();
            NetworkException failure;
            try {
                HttpTransport.TransportResponse response = transport.send(task.url(), timeout);
                if (response.isSuccess()) {
                    if (attempt > 1) {
                        logger.info("Fetched {} on attempt {}", task.url(), attempt);
                    }
                    return response.body() == null ? "" : response.body();
                }
                failure = NetworkException.forStatus(task.url(), response.statusCode(), attempt);
            } catch (IOException e) {
                failure = new NetworkException(task.url(), NetworkException.NO_STATUS, true, attempt,
                    "Request to " + task.url() + " failed: " + e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                logger.warn("Malformed URL for {}: {}", task, e.getMessage());
                throw new NetworkException(task.url(), NetworkException.NO_STATUS, false, attempt,
                    "Malformed URL " + task.url() + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException(task.url(), NetworkException.NO_STATUS, false, attempt,
                    "Interrupted while fetching " + task.url(), e);
            }

            if (!failure.isRetryable()) {
                logger.warn("Non-retryable failure for {}: {}", task, failure.getMessage());
                throw failure;
            }
            if (!backoff.shouldRetry(failure, attempt)) {
                logger.warn("Retries exhausted for {}: {}", task, failure.getMessage());
                throw failure.exhausted(attempt);
            }
            Duration delay = backoff.nextDelay(attempt);
            logger.warn("Attempt {}/{} for {} failed ({}); retrying in {} ms",
                attempt, backoff.maxAttempts(), task.url(), failure.getMessage(), delay.toMillis());
            backoff.sleep(delay);
            if (Thread.currentThread().isInterrupted()) {
                throw new NetworkException(task.url(), failure.statusCode(), false, attempt,
                    "Interrupted while backing off for " + task.url(), failure);
            }
        }
    }
}
