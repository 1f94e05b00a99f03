package com.delta.siteextract.crawl.model;

/**
 * Which step of conflict resolution picked a field's final value.
 */
public enum ResolutionRule {
    SINGLE_VALUE,
    CONFIDENCE,
    PAGE_AUTHORITY,
    CONTENT_LENGTH,
    FIRST_SEEN,
    LIST_UNION
}
