package com.delta.siteextract.crawl.model;

import java.util.List;

/**
 * What one site crawl hands back to the batch. {@code record} is null when {@code state} is
 * {@link SiteState#FAILED}; {@code failure} is null otherwise.
 */
public record SiteCrawlResult(
    String siteUrl,
    SiteState state,
    EntityRecord record,
    List<PageResult> pages,
    SiteStatistics statistics,
    SiteFailure failure
) {
    public SiteCrawlResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public boolean isDone() {
        return state == SiteState.DONE;
    }
}
