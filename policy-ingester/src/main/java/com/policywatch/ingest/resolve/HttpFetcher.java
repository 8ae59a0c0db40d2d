package com.policywatch.ingest.resolve;

import com.policywatch.ingest.config.IngesterProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * GET with bounded retry for listing pages, detail pages and documents.
 *
 * Retry policy: exponential backoff with jitter, capped attempts, each attempt with its own
 * read timeout (connect timeout lives on the shared {@link HttpClient}). Timeouts, resets,
 * 5xx and 429 are retried; other 4xx are returned immediately. Exhaustion yields a failed
 * {@link FetchResult}; this class never throws to its callers.
 */
@Service
@Slf4j
public class HttpFetcher {

    private final HttpClient httpClient;
    private final IngesterProperties.Http http;
    private final Retry retry;

    public HttpFetcher(HttpClient httpClient, IngesterProperties properties) {
        this.httpClient = httpClient;
        this.http = properties.getHttp();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, http.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Math.max(1, http.getInitialBackoffMs()), 2.0, 0.5,
                        Math.max(1, http.getMaxBackoffMs())))
                .retryExceptions(TransientFetchException.class)
                .build();
        this.retry = Retry.of("http-fetch", config);
        this.retry.getEventPublisher().onRetry(e -> log.debug("Retry {}/{} for {}: {}",
                e.getNumberOfRetryAttempts(), http.getMaxAttempts(), e.getName(),
                e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "?"));
    }

    public FetchResult fetch(String url) {
        try {
            return retry.executeSupplier(() -> attempt(url));
        } catch (TransientFetchException e) {
            log.warn("Giving up on {} after {} attempts: {}", url, http.getMaxAttempts(), e.getMessage());
            return FetchResult.transientFailure(url, e.getStatus(), e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private FetchResult attempt(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofMillis(http.getReadTimeoutMs()))
                    .header("User-Agent", http.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return FetchResult.permanentFailure(url, 0, "Malformed URL: " + e.getMessage());
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            // HttpTimeoutException, ConnectException and resets are all IOExceptions
            throw new TransientFetchException(e.getClass().getSimpleName() + ": " + e.getMessage(), 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.permanentFailure(url, 0, "Interrupted");
        }

        int status = response.statusCode();
        byte[] body;
        try (InputStream in = response.body()) {
            if (status == 429 || status >= 500) {
                throw new TransientFetchException("HTTP " + status + " for " + url, status, null);
            }
            if (status >= 400) {
                log.debug("HTTP {} for {} (not retried)", status, url);
                return FetchResult.permanentFailure(url, status, "HTTP " + status);
            }
            body = in.readNBytes(Math.max(0, http.getMaxBodyBytes()));
        } catch (IOException e) {
            throw new TransientFetchException("Body read failed for " + url + ": " + e.getMessage(), status, e);
        }

        return FetchResult.ok(
                url,
                response.uri().toString(),
                status,
                response.headers().firstValue("Content-Type").orElse(null),
                body,
                response.headers().firstValue("Last-Modified").map(HttpFetcher::parseHttpDate).orElse(null));
    }

    private static OffsetDateTime parseHttpDate(String value) {
        try {
            return OffsetDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
