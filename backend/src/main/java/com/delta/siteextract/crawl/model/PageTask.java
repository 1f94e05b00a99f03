package com.delta.siteextract.crawl.model;

/**
 * One page queued for a site crawl. {@code url} is already normalized and absolute.
 */
public record PageTask(
    String url,
    int depth,
    String parentUrl,
    PageType pageTypeHint
) {
    public static PageTask seed(String url) {
        return new PageTask(url, 0, null, null);
    }

    public PageTask child(String childUrl) {
        return new PageTask(childUrl, depth + 1, url, null);
    }

    public PageTask withPageType(PageType pageType) {
        return new PageTask(url, depth, parentUrl, pageType);
    }
}
