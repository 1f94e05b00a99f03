package com.delta.siteextract.crawl.extraction;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * A fetched page parsed once and shared by classification and every extraction strategy.
 */
public record PageContent(String url, Document document) {

    public static PageContent parse(String url, String html) {
        return new PageContent(url, Jsoup.parse(html == null ? "" : html, url == null ? "" : url));
    }

    public String visibleText() {
        return document.body() == null ? "" : document.body().text();
    }
}
