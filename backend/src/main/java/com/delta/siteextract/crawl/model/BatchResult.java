package com.delta.siteextract.crawl.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything a batch produced. Records and site results are in completion order, not input
 * order; each carries its originating start URL.
 */
public record BatchResult(
    List<EntityRecord> records,
    List<SiteFailure> failures,
    List<SiteCrawlResult> sites,
    BatchStatistics statistics
) {
    public BatchResult {
        records = records == null ? List.of() : List.copyOf(records);
        failures = failures == null ? List.of() : List.copyOf(failures);
        sites = sites == null ? List.of() : List.copyOf(sites);
    }

    public Optional<EntityRecord> recordFor(String siteUrl) {
        return records.stream().filter(record -> record.siteUrl().equals(siteUrl)).findFirst();
    }

    public Optional<SiteFailure> failureFor(String siteUrl) {
        return failures.stream().filter(failure -> failure.siteUrl().equals(siteUrl)).findFirst();
    }

    public Optional<SiteCrawlResult> siteFor(String siteUrl) {
        return sites.stream().filter(site -> site.siteUrl().equals(siteUrl)).findFirst();
    }
}
