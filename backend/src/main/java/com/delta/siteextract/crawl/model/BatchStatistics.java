package com.delta.siteextract.crawl.model;

import java.time.Duration;

public record BatchStatistics(
    int sitesAttempted,
    int sitesSucceeded,
    int sitesFailed,
    int sitesNotStarted,
    int pagesProcessed,
    int pagesFailed,
    long bytesFetched,
    Duration elapsed,
    long memoryHighWaterBytes,
    boolean cancelled
) {
}
