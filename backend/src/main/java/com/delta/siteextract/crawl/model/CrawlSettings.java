package com.delta.siteextract.crawl.model;

import com.delta.siteextract.config.ExtractorProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable options for one batch run. Built once from {@link ExtractorProperties} and never
 * re-read while the run is in flight.
 */
public record CrawlSettings(
    String userAgent,
    int maxPagesPerSite,
    int maxCrawlDepth,
    Duration perDomainInterval,
    Duration pageTimeout,
    Duration siteTimeout,
    int maxRetries,
    Duration retryBaseDelay,
    Duration retryMaxDelay,
    boolean followExternalLinks,
    List<String> includePatterns,
    List<String> excludePatterns,
    int batchConcurrency,
    long memoryBudgetBytes,
    boolean robotsEnabled,
    boolean robotsFailOpen
) {
    private static final long BYTES_PER_MB = 1024L * 1024L;

    public CrawlSettings {
        userAgent = ExtractorProperties.normalizeUserAgent(userAgent);
        includePatterns = includePatterns == null ? List.of() : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public static CrawlSettings from(ExtractorProperties properties) {
        ExtractorProperties.Robots robots = properties.getRobots() == null
            ? new ExtractorProperties.Robots()
            : properties.getRobots();
        return new CrawlSettings(
            properties.getUserAgent(),
            properties.getMaxPagesPerSite(),
            properties.getMaxCrawlDepth(),
            properties.getPerDomainInterval(),
            properties.getPageTimeout(),
            properties.getSiteTimeout(),
            properties.getMaxRetries(),
            properties.getRetryBaseDelay(),
            properties.getRetryMaxDelay(),
            properties.isFollowExternalLinks(),
            properties.getIncludePatterns(),
            properties.getExcludePatterns(),
            properties.getBatchConcurrency(),
            properties.getMemoryBudgetMb() * BYTES_PER_MB,
            robots.isEnabled(),
            robots.isFailOpen()
        );
    }

    /**
     * Rejects configurations that cannot describe a sensible run.
     *
     * @return this snapshot, for chaining
     * @throws InvalidCrawlSettingsException listing every invalid option found
     */
    public CrawlSettings validate() {
        List<String> problems = new ArrayList<>();
        if (maxPagesPerSite < 1) {
            problems.add("maxPagesPerSite must be >= 1 (was " + maxPagesPerSite + ")");
        }
        if (maxCrawlDepth < 0) {
            problems.add("maxCrawlDepth must be >= 0 (was " + maxCrawlDepth + ")");
        }
        if (maxRetries < 0) {
            problems.add("maxRetries must be >= 0 (was " + maxRetries + ")");
        }
        if (batchConcurrency < 1) {
            problems.add("batchConcurrency must be >= 1 (was " + batchConcurrency + ")");
        }
        if (memoryBudgetBytes <= 0) {
            problems.add("memoryBudgetMb must be > 0");
        }
        requireNonNegative("perDomainInterval", perDomainInterval, problems);
        requirePositive("pageTimeout", pageTimeout, problems);
        requirePositive("siteTimeout", siteTimeout, problems);
        requireNonNegative("retryBaseDelay", retryBaseDelay, problems);
        requireNonNegative("retryMaxDelay", retryMaxDelay, problems);
        checkPatterns("includePatterns", includePatterns, problems);
        checkPatterns("excludePatterns", excludePatterns, problems);
        if (!problems.isEmpty()) {
            throw new InvalidCrawlSettingsException("invalid crawl settings: " + String.join("; ", problems));
        }
        return this;
    }

    public List<Pattern> compiledIncludePatterns() {
        return compile(includePatterns);
    }

    public List<Pattern> compiledExcludePatterns() {
        return compile(excludePatterns);
    }

    private static void requirePositive(String name, Duration value, List<String> problems) {
        if (value == null || value.isNegative() || value.isZero()) {
            problems.add(name + " must be a positive duration (was " + value + ")");
        }
    }

    private static void requireNonNegative(String name, Duration value, List<String> problems) {
        if (value == null || value.isNegative()) {
            problems.add(name + " must not be negative (was " + value + ")");
        }
    }

    private static void checkPatterns(String name, List<String> patterns, List<String> problems) {
        for (String pattern : patterns) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                problems.add(name + " contains an invalid pattern: " + pattern);
            }
        }
    }

    private static List<Pattern> compile(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
        }
        return compiled;
    }
}
