package com.delta.siteextract.crawl;

import com.delta.siteextract.config.ExtractorProperties;
import com.delta.siteextract.crawl.aggregate.DataAggregator;
import com.delta.siteextract.crawl.aggregate.PageAuthorityTable;
import com.delta.siteextract.crawl.discovery.PageClassifier;
import com.delta.siteextract.crawl.discovery.PageTypeRules;
import com.delta.siteextract.crawl.extraction.ExtractionEngine;
import com.delta.siteextract.crawl.extraction.HeuristicStrategy;
import com.delta.siteextract.crawl.extraction.MicrodataStrategy;
import com.delta.siteextract.crawl.extraction.StructuredDataStrategy;
import com.delta.siteextract.crawl.http.DomainRateLimiter;
import com.delta.siteextract.crawl.http.PageFetcher;
import com.delta.siteextract.crawl.http.PoliteHttpClient;
import com.delta.siteextract.crawl.robots.RobotsTxtService;
import com.delta.siteextract.crawl.service.SiteCrawlerService;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Wires the crawl pipeline by hand for tests that run against MockWebServer.
 */
public final class CrawlTestSupport {

    private CrawlTestSupport() {
    }

    /** Fast settings: no spacing, short timeouts, tiny retry delays, robots off. */
    public static ExtractorProperties fastProperties() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.setUserAgent("delta-site-extractor-test/1.0");
        properties.setPerDomainInterval(Duration.ZERO);
        properties.setPageTimeout(Duration.ofSeconds(5));
        properties.setSiteTimeout(Duration.ofSeconds(30));
        properties.setMaxRetries(2);
        properties.setRetryBaseDelay(Duration.ofMillis(1));
        properties.setRetryMaxDelay(Duration.ofMillis(5));
        properties.setBatchConcurrency(2);
        properties.getRobots().setEnabled(false);
        return properties;
    }

    public static ExtractionEngine extractionEngine() {
        return new ExtractionEngine(List.of(
            new HeuristicStrategy(),
            new StructuredDataStrategy(new ObjectMapper()),
            new MicrodataStrategy()
        ));
    }

    public static PoliteHttpClient httpClient(ExecutorService executor) {
        return new PoliteHttpClient(executor, new DomainRateLimiter());
    }

    public static SiteCrawlerService siteCrawler(ExecutorService executor) {
        PoliteHttpClient httpClient = httpClient(executor);
        PageTypeRules rules = PageTypeRules.restaurantDefaults();
        return new SiteCrawlerService(
            new PageFetcher(httpClient, new RobotsTxtService(httpClient)),
            new PageClassifier(rules),
            extractionEngine(),
            new DataAggregator(PageAuthorityTable.restaurantDefaults()),
            rules
        );
    }

    public static String html(String head, String body) {
        return "<html><head>" + head + "</head><body>" + body + "</body></html>";
    }
}
