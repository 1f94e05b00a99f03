package com.delta.siteextract.crawl.model;

import java.util.List;

public record BatchRequest(List<String> startUrls, FieldSchema schema, CrawlSettings settings) {
    public BatchRequest {
        startUrls = startUrls == null ? List.of() : List.copyOf(startUrls);
    }
}
