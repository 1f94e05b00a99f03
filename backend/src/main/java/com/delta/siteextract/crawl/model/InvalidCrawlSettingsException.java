package com.delta.siteextract.crawl.model;

public class InvalidCrawlSettingsException extends IllegalArgumentException {
    public InvalidCrawlSettingsException(String message) {
        super(message);
    }

    public InvalidCrawlSettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
