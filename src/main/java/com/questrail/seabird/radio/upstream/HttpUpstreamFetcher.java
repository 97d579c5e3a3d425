package com.questrail.seabird.radio.upstream;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous HTTP GET returning the response body as text.
 *
 * <p>Status handling: 2xx yields the body; 429 and 5xx fail with a retryable
 * {@link UpstreamFetchException}; any other status fails with a non-retryable
 * one. Connection errors and request timeouts surface as
 * {@link java.io.IOException} and are retryable.</p>
 */
public final class HttpUpstreamFetcher {

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String userAgent;

    public HttpUpstreamFetcher(HttpClient httpClient, Duration requestTimeout, String userAgent) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    public static HttpUpstreamFetcher create(Duration requestTimeout, String userAgent) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new HttpUpstreamFetcher(client, requestTimeout, userAgent);
    }

    public CompletableFuture<String> get(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status >= 200 && status < 300) {
                        return response.body();
                    }
                    boolean retryable = status == 429 || status >= 500;
                    throw new UpstreamFetchException("GET " + uri + " returned HTTP " + status, retryable);
                });
    }
}
