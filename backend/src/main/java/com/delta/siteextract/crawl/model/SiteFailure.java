package com.delta.siteextract.crawl.model;

/**
 * A site that produced no entity record. {@code reason} is a stable key such as
 * {@code start_page_failed:http_404} or {@code not_started_memory_budget}.
 */
public record SiteFailure(String siteUrl, String reason, ErrorCategory category, String detail) {
}
