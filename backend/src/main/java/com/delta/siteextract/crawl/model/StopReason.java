package com.delta.siteextract.crawl.model;

public enum StopReason {
    QUEUE_EXHAUSTED,
    PAGE_LIMIT,
    SITE_TIMEOUT,
    CANCELLED,
    START_PAGE_FAILED
}
