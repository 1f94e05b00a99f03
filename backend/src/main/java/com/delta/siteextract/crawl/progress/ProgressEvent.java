package com.delta.siteextract.crawl.progress;

import com.delta.siteextract.crawl.model.PageType;

import java.time.Instant;

/**
 * One progress notification. {@code status} is the page status for page events, the final
 * site state for {@link ProgressEventType#SITE_COMPLETED}, and null otherwise.
 */
public record ProgressEvent(
    ProgressEventType type,
    String siteUrl,
    String pageUrl,
    PageType pageType,
    String status,
    int pagesCompleted,
    int pagesTotal,
    int sitesCompleted,
    int sitesTotal,
    Instant timestamp
) {
}
