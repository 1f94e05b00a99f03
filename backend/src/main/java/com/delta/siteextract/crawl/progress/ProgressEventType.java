package com.delta.siteextract.crawl.progress;

public enum ProgressEventType {
    SITE_STARTED,
    PAGE_STARTED,
    PAGE_COMPLETED,
    SITE_COMPLETED,
    BATCH_COMPLETED
}
