package com.delta.siteextract.crawl.model;

import java.util.List;

/**
 * Page type plus the outbound links worth queueing, after filtering and dedup.
 */
public record Classification(PageType pageType, List<String> discoveredLinks, int droppedLinks) {
    public Classification {
        pageType = pageType == null ? PageType.OTHER : pageType;
        discoveredLinks = discoveredLinks == null ? List.of() : List.copyOf(discoveredLinks);
    }
}
