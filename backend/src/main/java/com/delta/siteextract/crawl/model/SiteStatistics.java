package com.delta.siteextract.crawl.model;

import java.time.Duration;

public record SiteStatistics(
    int pagesAttempted,
    int pagesSucceeded,
    int pagesFailed,
    int pagesSkipped,
    long bytesFetched,
    Duration duration,
    StopReason stopReason
) {
}
