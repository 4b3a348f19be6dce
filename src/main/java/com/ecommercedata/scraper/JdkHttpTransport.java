package com.ecommercedata.scraper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link HttpTransport} over {@link HttpClient}. Follows redirects and rotates the
 * {@code User-Agent} header through the configured pool.
 */
public class JdkHttpTransport implements HttpTransport {
    private final HttpClient client;
    private final List<String> userAgents;

    public JdkHttpTransport(List<String> userAgents, Duration connectTimeout) {
        if (userAgents == null || userAgents.isEmpty()) {
            throw new IllegalArgumentException("At least one user agent is required");
        }
        this.userAgents = List.copyOf(userAgents);
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public TransportResponse send(String url, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("User-Agent", pickUserAgent())
            .header("Accept", "text/html,application/json;q=0.9,*/*;q=0.8")
            .GET()
            .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        return new TransportResponse(response.statusCode(), response.body());
    }

    private String pickUserAgent() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
