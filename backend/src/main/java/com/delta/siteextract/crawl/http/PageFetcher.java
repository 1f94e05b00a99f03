package com.delta.siteextract.crawl.http;

import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.model.FetchFailure;
import com.delta.siteextract.crawl.model.FetchResult;
import com.delta.siteextract.crawl.robots.RobotsRules;
import com.delta.siteextract.crawl.robots.RobotsTxtService;
import com.delta.siteextract.crawl.util.FailureClassifier;
import com.delta.siteextract.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Fetches one page for a site crawl: robots check, per-domain spacing (raised to the site's
 * Crawl-delay when it declares one), retries and timeout.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PoliteHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;

    public PageFetcher(PoliteHttpClient httpClient, RobotsTxtService robotsTxtService) {
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
    }

    public FetchResult fetch(String url, Duration timeout, CrawlSettings settings) {
        Instant startedAt = Instant.now();
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null) {
            return FetchResult.failed(url, startedAt, 0, FetchFailure.invalidUrl("not an absolute http(s) URL"));
        }

        Duration interval = settings.perDomainInterval();
        if (settings.robotsEnabled()) {
            RobotsRules rules = robotsTxtService.rulesFor(normalized, settings);
            if (!rules.isAllowed(UrlNormalizer.pathAndQuery(normalized))) {
                log.debug("robots disallowed url={}", normalized);
                return FetchResult.failed(url, startedAt, 0, FetchFailure.blocked(FailureClassifier.ROBOTS_DISALLOWED));
            }
            Duration crawlDelay = rules.getCrawlDelay();
            if (crawlDelay != null && crawlDelay.compareTo(interval) > 0) {
                interval = crawlDelay;
            }
        }

        FetchResult result = httpClient.get(normalized, RequestPolicy.forPage(settings, timeout, interval));
        if (!result.isSuccessful()) {
            log.debug(
                "fetch failed url={} status={} failure={} attempts={}",
                normalized,
                result.statusCode(),
                result.failure() == null ? null : result.failure().errorKey(),
                result.attempts()
            );
        }
        return result;
    }
}
