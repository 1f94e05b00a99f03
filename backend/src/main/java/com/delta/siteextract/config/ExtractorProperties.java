package com.delta.siteextract.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Crawl and extraction options bound from the {@code extractor} prefix.
 *
 * <p>Values are stored as given; range checks happen in
 * {@link com.delta.siteextract.crawl.model.CrawlSettings#validate()} so that a misconfigured
 * run fails before any site is contacted.
 */
@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {
    private static final String DEFAULT_USER_AGENT = "delta-site-extractor/0.1 (+contact)";

    private String userAgent;
    private int maxPagesPerSite = 10;
    private int maxCrawlDepth = 2;
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration perDomainInterval = Duration.ofMillis(2000);
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration pageTimeout = Duration.ofSeconds(30);
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration siteTimeout = Duration.ofSeconds(300);
    private int maxRetries = 3;
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration retryBaseDelay = Duration.ofMillis(500);
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration retryMaxDelay = Duration.ofSeconds(8);
    private boolean followExternalLinks = false;
    private List<String> includePatterns = new ArrayList<>();
    private List<String> excludePatterns = new ArrayList<>();
    private int batchConcurrency = 5;
    private long memoryBudgetMb = 512;
    private int progressBufferSize = 1024;
    private Robots robots = new Robots();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxPagesPerSite() {
        return maxPagesPerSite;
    }

    public void setMaxPagesPerSite(int maxPagesPerSite) {
        this.maxPagesPerSite = maxPagesPerSite;
    }

    public int getMaxCrawlDepth() {
        return maxCrawlDepth;
    }

    public void setMaxCrawlDepth(int maxCrawlDepth) {
        this.maxCrawlDepth = maxCrawlDepth;
    }

    public Duration getPerDomainInterval() {
        return perDomainInterval;
    }

    public void setPerDomainInterval(Duration perDomainInterval) {
        this.perDomainInterval = perDomainInterval;
    }

    public Duration getPageTimeout() {
        return pageTimeout;
    }

    public void setPageTimeout(Duration pageTimeout) {
        this.pageTimeout = pageTimeout;
    }

    public Duration getSiteTimeout() {
        return siteTimeout;
    }

    public void setSiteTimeout(Duration siteTimeout) {
        this.siteTimeout = siteTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public void setRetryMaxDelay(Duration retryMaxDelay) {
        this.retryMaxDelay = retryMaxDelay;
    }

    public boolean isFollowExternalLinks() {
        return followExternalLinks;
    }

    public void setFollowExternalLinks(boolean followExternalLinks) {
        this.followExternalLinks = followExternalLinks;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public void setIncludePatterns(List<String> includePatterns) {
        this.includePatterns = includePatterns == null ? new ArrayList<>() : includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns == null ? new ArrayList<>() : excludePatterns;
    }

    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = batchConcurrency;
    }

    public long getMemoryBudgetMb() {
        return memoryBudgetMb;
    }

    public void setMemoryBudgetMb(long memoryBudgetMb) {
        this.memoryBudgetMb = memoryBudgetMb;
    }

    public int getProgressBufferSize() {
        return Math.max(1, progressBufferSize);
    }

    public void setProgressBufferSize(int progressBufferSize) {
        this.progressBufferSize = Math.max(1, progressBufferSize);
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Robots {
        private boolean enabled = true;
        private boolean failOpen = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }
    }
}
