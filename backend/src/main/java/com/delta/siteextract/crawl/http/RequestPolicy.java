package com.delta.siteextract.crawl.http;

import com.delta.siteextract.crawl.model.CrawlSettings;

import java.time.Duration;

/**
 * Per-request knobs for {@link PoliteHttpClient}.
 *
 * @param interval minimum spacing between requests to the same domain
 * @param timeout  hard limit for a single attempt
 * @param maxRetries retries after the first attempt, for transient failures only
 */
public record RequestPolicy(
    String userAgent,
    String accept,
    Duration timeout,
    Duration interval,
    int maxRetries,
    Duration retryBaseDelay,
    Duration retryMaxDelay
) {
    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";
    public static final String TEXT_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";

    public static RequestPolicy forPage(CrawlSettings settings, Duration timeout, Duration interval) {
        return new RequestPolicy(
            settings.userAgent(),
            HTML_ACCEPT,
            timeout,
            interval,
            settings.maxRetries(),
            settings.retryBaseDelay(),
            settings.retryMaxDelay()
        );
    }

    public RequestPolicy withAccept(String acceptHeader) {
        return new RequestPolicy(userAgent, acceptHeader, timeout, interval, maxRetries, retryBaseDelay, retryMaxDelay);
    }

    public RequestPolicy withMaxRetries(int retries) {
        return new RequestPolicy(userAgent, accept, timeout, interval, retries, retryBaseDelay, retryMaxDelay);
    }

    public RequestPolicy withTimeout(Duration newTimeout) {
        return new RequestPolicy(userAgent, accept, newTimeout, interval, maxRetries, retryBaseDelay, retryMaxDelay);
    }
}
