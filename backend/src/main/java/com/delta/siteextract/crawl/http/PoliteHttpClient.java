package com.delta.siteextract.crawl.http;

import com.delta.siteextract.crawl.model.FetchFailure;
import com.delta.siteextract.crawl.model.FetchResult;
import com.delta.siteextract.crawl.util.FailureClassifier;
import com.delta.siteextract.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * GET client that waits out the per-domain interval before every attempt and retries transient
 * failures with jittered exponential backoff. Errors come back as {@link FetchFailure} values.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(60);

    private final HttpClient client;
    private final DomainRateLimiter rateLimiter;

    public PoliteHttpClient(
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        DomainRateLimiter rateLimiter
    ) {
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(CONNECT_TIMEOUT)
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.rateLimiter = rateLimiter;
    }

    public FetchResult get(String url, RequestPolicy policy) {
        Instant startedAt = Instant.now();
        int maxAttempts = Math.max(1, 1 + policy.maxRetries());
        FetchResult lastResult = null;
        int attempts = 0;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attempts = attempt;
            lastResult = executeOnce(url, policy);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                break;
            }
            log.debug(
                "retrying url={} attempt={} failure={}",
                url,
                attempt,
                lastResult.failure() == null ? null : lastResult.failure().errorKey()
            );
            if (!sleepBackoff(attempt, policy)) {
                break;
            }
        }
        return lastResult.withAttempts(attempts, Duration.between(startedAt, Instant.now()));
    }

    private FetchResult executeOnce(String url, RequestPolicy policy) {
        Instant startedAt = Instant.now();
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return FetchResult.failed(url, startedAt, 0, FetchFailure.invalidUrl("URL missing host or malformed"));
        }
        String hostKey = UrlNormalizer.hostKey(url);
        try {
            rateLimiter.awaitTurn(hostKey, policy.interval());
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(policy.timeout())
                .header("User-Agent", policy.userAgent())
                .header("Accept", policy.accept() == null || policy.accept().isBlank() ? "*/*" : policy.accept())
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status == 429) {
                rateLimiter.extendBackoff(hostKey, retryAfter(response).orElse(policy.retryBaseDelay()));
            } else if (status == 403) {
                rateLimiter.extendBackoff(hostKey, policy.retryMaxDelay());
            }
            byte[] bytes = response.body();
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            String body = bytes == null ? null : new String(bytes, charsetOf(contentType));
            FetchFailure failure = status >= 200 && status < 300 ? null : FetchFailure.httpError(status);
            return new FetchResult(
                url,
                response.uri(),
                status,
                body,
                contentType,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                1,
                failure
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failed(url, startedAt, 0, FailureClassifier.fromException(e));
        } catch (IOException e) {
            return FetchResult.failed(url, startedAt, 0, FailureClassifier.fromException(e));
        } catch (IllegalArgumentException e) {
            return FetchResult.failed(url, startedAt, 0, FetchFailure.invalidUrl(e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("unexpected fetch error url={} error={}", url, e.toString());
            return FetchResult.failed(url, startedAt, 0, FailureClassifier.fromException(e));
        }
    }

    private boolean shouldRetry(FetchResult result) {
        return result != null && FailureClassifier.isRetryable(result.failure());
    }

    private boolean sleepBackoff(int attempt, RequestPolicy policy) {
        long baseDelayMs = policy.retryBaseDelay() == null ? 0L : policy.retryBaseDelay().toMillis();
        if (baseDelayMs <= 0) {
            return true;
        }
        long maxDelayMs = policy.retryMaxDelay() == null ? 0L : policy.retryMaxDelay().toMillis();
        long delay = baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static Optional<Duration> retryAfter(HttpResponse<?> response) {
        Optional<String> header = response.headers().firstValue("Retry-After");
        if (header.isEmpty()) {
            return Optional.empty();
        }
        try {
            long seconds = Long.parseLong(header.get().trim());
            if (seconds < 0) {
                return Optional.empty();
            }
            Duration wait = Duration.ofSeconds(seconds);
            return Optional.of(wait.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : wait);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim().toLowerCase(Locale.ROOT);
            if (trimmed.startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
