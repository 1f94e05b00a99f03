package com.delta.siteextract.crawl.model;

public enum SiteState {
    DISCOVERING,
    CRAWLING,
    AGGREGATING,
    DONE,
    FAILED
}
