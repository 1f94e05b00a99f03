package com.delta.siteextract.crawl.service;

import com.delta.siteextract.crawl.model.BatchResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A batch running in the background. Cancelling stops new sites and new pages; partial results
 * are still returned.
 */
public class BatchHandle {
    private final CancellationSignal cancellation;
    private final CompletableFuture<BatchResult> result;

    BatchHandle(CancellationSignal cancellation, CompletableFuture<BatchResult> result) {
        this.cancellation = cancellation;
        this.result = result;
    }

    public void cancel() {
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<BatchResult> result() {
        return result;
    }

    public BatchResult await() {
        return result.join();
    }

    public BatchResult await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
