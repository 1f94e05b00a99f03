package com.delta.siteextract.crawl.model;

public enum PageStatus {
    SUCCESS,
    FAILED,
    TIMEOUT,
    SKIPPED_DUPLICATE
}
