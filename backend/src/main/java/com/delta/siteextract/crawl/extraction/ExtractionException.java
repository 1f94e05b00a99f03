package com.delta.siteextract.crawl.extraction;

/**
 * Raised by a strategy when a page's content is too malformed to read. Never leaves the
 * {@link ExtractionEngine}.
 */
public class ExtractionException extends RuntimeException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
