package com.ecommercedata.scraper;

import java.io.IOException;
import java.time.Duration;

/**
 * Single HTTP GET, without retries. {@link RetryingHttpClient} adds the retry policy on top.
 */
@FunctionalInterface
public interface HttpTransport {
    /**
     * Plain response of one GET request.
     */
    record TransportResponse(int statusCode, String body) {
        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }

    TransportResponse send(String url, Duration timeout) throws IOException, InterruptedException;
}
