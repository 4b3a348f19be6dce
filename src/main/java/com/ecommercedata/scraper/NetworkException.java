package com.ecommercedata.scraper;

/**
 * Connection failure, timeout or unexpected HTTP status while fetching a URL.
 * <p>
 * Transport failures and 5xx responses are retryable; any other non-2xx status is not.
 * The crawl recovers from this error by skipping the page it belongs to.
 */
public class NetworkException extends PipelineException {
    /** Status used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final String url;
    private final int statusCode;
    private final boolean retryable;
    private final int attempts;

    public NetworkException(String url, int statusCode, boolean retryable, int attempts, String message, Throwable cause) {
        super("fetch", message, cause);
        this.url = url;
        this.statusCode = statusCode;
        this.retryable = retryable;
        this.attempts = attempts;
    }

    public NetworkException(String url, int statusCode, boolean retryable, int attempts, String message) {
        this(url, statusCode, retryable, attempts, message, null);
    }

    public static NetworkException forStatus(String url, int statusCode, int attempts) {
        boolean serverError = statusCode >= 500 && statusCode <= 599;
        return new NetworkException(url, statusCode, serverError, attempts,
                "HTTP " + statusCode + " from " + url);
    }

    /**
     * Copy of this error with the final attempt count, used once the retry budget is spent.
     */
    public NetworkException exhausted(int totalAttempts) {
        return new NetworkException(url, statusCode, false, totalAttempts,
                "Giving up on " + url + " after " + totalAttempts + " attempts: " + getMessage(), this);
    }

    public String url() {
        return url;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int attempts() {
        return attempts;
    }
}
