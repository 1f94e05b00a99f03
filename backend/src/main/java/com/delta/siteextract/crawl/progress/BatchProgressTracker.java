package com.delta.siteextract.crawl.progress;

import com.delta.siteextract.crawl.model.PageStatus;
import com.delta.siteextract.crawl.model.PageType;
import com.delta.siteextract.crawl.model.SiteState;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch-wide counters stamped onto every progress event of one run.
 */
public class BatchProgressTracker {
    private final ProgressEventBus bus;
    private final int sitesTotal;
    private final AtomicInteger sitesCompleted = new AtomicInteger();

    public BatchProgressTracker(ProgressEventBus bus, int sitesTotal) {
        this.bus = bus;
        this.sitesTotal = sitesTotal;
    }

    /** Tracker for a crawl outside any batch; events are discarded. */
    public static BatchProgressTracker detached() {
        return new BatchProgressTracker(null, 1);
    }

    public void siteStarted(String siteUrl) {
        publish(ProgressEventType.SITE_STARTED, siteUrl, null, null, null, 0, 0);
    }

    public void pageStarted(String siteUrl, String pageUrl, int pagesCompleted, int pagesTotal) {
        publish(ProgressEventType.PAGE_STARTED, siteUrl, pageUrl, null, null, pagesCompleted, pagesTotal);
    }

    public void pageCompleted(
        String siteUrl,
        String pageUrl,
        PageType pageType,
        PageStatus status,
        int pagesCompleted,
        int pagesTotal
    ) {
        publish(
            ProgressEventType.PAGE_COMPLETED,
            siteUrl,
            pageUrl,
            pageType,
            status.name().toLowerCase(Locale.ROOT),
            pagesCompleted,
            pagesTotal
        );
    }

    public void siteCompleted(String siteUrl, SiteState state, int pagesCompleted, int pagesTotal) {
        sitesCompleted.incrementAndGet();
        publish(ProgressEventType.SITE_COMPLETED, siteUrl, null, null, state.name(), pagesCompleted, pagesTotal);
    }

    public void batchCompleted(int pagesProcessed) {
        publish(ProgressEventType.BATCH_COMPLETED, null, null, null, null, pagesProcessed, pagesProcessed);
    }

    public int sitesCompleted() {
        return sitesCompleted.get();
    }

    public int sitesTotal() {
        return sitesTotal;
    }

    private void publish(
        ProgressEventType type,
        String siteUrl,
        String pageUrl,
        PageType pageType,
        String status,
        int pagesCompleted,
        int pagesTotal
    ) {
        if (bus == null) {
            return;
        }
        bus.publish(new ProgressEvent(
            type,
            siteUrl,
            pageUrl,
            pageType,
            status,
            pagesCompleted,
            pagesTotal,
            sitesCompleted.get(),
            sitesTotal,
            Instant.now()
        ));
    }
}
