package com.delta.siteextract.crawl.robots;

import com.delta.siteextract.crawl.http.PoliteHttpClient;
import com.delta.siteextract.crawl.http.RequestPolicy;
import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.model.FetchResult;
import com.delta.siteextract.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fetches and caches robots.txt per origin. A 4xx answer means there are no rules; an
 * unreachable or failing robots.txt is resolved by the run's fail-open setting and re-fetched
 * after {@link #UNAVAILABLE_TTL}.
 */
@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final Duration UNAVAILABLE_TTL = Duration.ofMinutes(10);
    private static final Duration MAX_ROBOTS_TIMEOUT = Duration.ofSeconds(10);

    private final PoliteHttpClient httpClient;
    private final Map<String, CachedRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public RobotsRules rulesFor(String url, CrawlSettings settings) {
        String origin = UrlNormalizer.origin(url);
        if (origin == null) {
            return RobotsRules.allowAll();
        }
        String key = origin + "|" + settings.userAgent() + "|" + settings.robotsFailOpen();
        CachedRules cached = cache.get(key);
        if (cached != null && !cached.isExpired()) {
            return cached.rules();
        }
        CachedRules loaded = load(origin, settings);
        cache.put(key, loaded);
        return loaded.rules();
    }

    public boolean isAllowed(String url, CrawlSettings settings) {
        return rulesFor(url, settings).isAllowed(UrlNormalizer.pathAndQuery(url));
    }

    private CachedRules load(String origin, CrawlSettings settings) {
        String robotsUrl = origin + "/robots.txt";
        Duration timeout = settings.pageTimeout().compareTo(MAX_ROBOTS_TIMEOUT) > 0 ? MAX_ROBOTS_TIMEOUT : settings.pageTimeout();
        RequestPolicy policy = RequestPolicy.forPage(settings, timeout, settings.perDomainInterval())
            .withAccept(RequestPolicy.TEXT_ACCEPT)
            .withMaxRetries(0);
        FetchResult fetch = httpClient.get(robotsUrl, policy);
        if (fetch.isSuccessful()) {
            RobotsRules rules = RobotsRules.parse(fetch.body(), settings.userAgent());
            log.debug("loaded robots origin={} rules={} crawlDelay={}", origin, rules.getRules().size(), rules.getCrawlDelay());
            return new CachedRules(rules, null);
        }
        if (fetch.statusCode() >= 400 && fetch.statusCode() < 500) {
            log.debug("no robots origin={} status={} decision=allow_all", origin, fetch.statusCode());
            return new CachedRules(RobotsRules.allowAll(), null);
        }
        boolean failOpen = settings.robotsFailOpen();
        log.warn(
            "robots fetch failed origin={} status={} error={} decision={}",
            origin,
            fetch.statusCode(),
            fetch.failure() == null ? null : fetch.failure().detail(),
            failOpen ? "allow_all" : "disallow_all"
        );
        return new CachedRules(
            failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll(),
            Instant.now().plus(UNAVAILABLE_TTL)
        );
    }

    private record CachedRules(RobotsRules rules, Instant expiresAt) {
        boolean isExpired() {
            return expiresAt != null && expiresAt.isBefore(Instant.now());
        }
    }
}
