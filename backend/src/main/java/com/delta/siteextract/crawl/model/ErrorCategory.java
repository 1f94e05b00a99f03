package com.delta.siteextract.crawl.model;

public enum ErrorCategory {
    TRANSIENT_NETWORK,
    PERMANENT_FETCH,
    TIMEOUT,
    POLICY_BLOCKED,
    EXTRACTION
}
