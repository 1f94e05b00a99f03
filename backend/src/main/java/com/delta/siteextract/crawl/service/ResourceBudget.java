package com.delta.siteextract.crawl.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative memory estimate for one batch: bytes of page content fetched by every launched
 * site, plus a sampled JVM heap high-water mark for reporting.
 */
public class ResourceBudget {
    private final long limitBytes;
    private final AtomicLong usedBytes = new AtomicLong();
    private final AtomicLong heapHighWaterBytes = new AtomicLong();

    public ResourceBudget(long limitBytes) {
        this.limitBytes = limitBytes;
    }

    public void recordBytes(long bytes) {
        if (bytes > 0) {
            usedBytes.addAndGet(bytes);
        }
        sampleHeap();
    }

    public boolean isExhausted() {
        return usedBytes.get() >= limitBytes;
    }

    public long usedBytes() {
        return usedBytes.get();
    }

    public long limitBytes() {
        return limitBytes;
    }

    public long heapHighWaterBytes() {
        return heapHighWaterBytes.get();
    }

    public void sampleHeap() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        heapHighWaterBytes.accumulateAndGet(used, Math::max);
    }
}
