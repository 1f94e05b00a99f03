package com.delta.siteextract.crawl.service;

import com.delta.siteextract.crawl.progress.BatchProgressTracker;

/**
 * Batch-owned collaborators handed to each site crawl.
 */
public record CrawlContext(CancellationSignal cancellation, BatchProgressTracker progress, ResourceBudget budget) {

    public static CrawlContext standalone(long memoryBudgetBytes) {
        return new CrawlContext(new CancellationSignal(), BatchProgressTracker.detached(), new ResourceBudget(memoryBudgetBytes));
    }
}
