package com.delta.siteextract.crawl.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch-wide stop flag. Site crawls check it between pages; an in-flight fetch is allowed to
 * finish.
 */
public class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
