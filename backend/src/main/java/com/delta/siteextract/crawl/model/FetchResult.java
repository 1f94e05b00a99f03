package com.delta.siteextract.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a single fetch, including retries. Exactly one of {@code body} (on success) or
 * {@code failure} is meaningful.
 */
public record FetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    FetchFailure failure
) {
    public boolean isSuccessful() {
        return failure == null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public Integer statusCodeOrNull() {
        return statusCode > 0 ? statusCode : null;
    }

    public long bodyLength() {
        return body == null ? 0L : body.length();
    }

    public FetchResult withAttempts(int totalAttempts, Duration totalDuration) {
        return new FetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            contentType,
            fetchedAt,
            totalDuration,
            totalAttempts,
            failure
        );
    }

    public static FetchResult failed(String url, Instant startedAt, int statusCode, FetchFailure failure) {
        return new FetchResult(
            url,
            null,
            statusCode,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            1,
            failure
        );
    }
}
