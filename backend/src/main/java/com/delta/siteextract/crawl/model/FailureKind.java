package com.delta.siteextract.crawl.model;

public enum FailureKind {
    TIMEOUT,
    HTTP_ERROR,
    NETWORK_ERROR,
    BLOCKED,
    INVALID_URL
}
