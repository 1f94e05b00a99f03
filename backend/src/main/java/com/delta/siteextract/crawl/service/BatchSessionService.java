package com.delta.siteextract.crawl.service;

import com.delta.siteextract.config.ExtractorProperties;
import com.delta.siteextract.crawl.model.BatchRequest;
import com.delta.siteextract.crawl.model.BatchResult;
import com.delta.siteextract.crawl.model.BatchStatistics;
import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.model.EntityRecord;
import com.delta.siteextract.crawl.model.ErrorCategory;
import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.SiteCrawlResult;
import com.delta.siteextract.crawl.model.SiteFailure;
import com.delta.siteextract.crawl.model.SiteState;
import com.delta.siteextract.crawl.progress.BatchProgressTracker;
import com.delta.siteextract.crawl.progress.ProgressEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Runs a list of start URLs as one batch: at most {@code batchConcurrency} sites in flight,
 * no new site once the memory budget is spent or the batch is cancelled, and one site's crash
 * never takes down the others.
 */
@Service
public class BatchSessionService {
    private static final Logger log = LoggerFactory.getLogger(BatchSessionService.class);

    static final String NOT_STARTED_CANCELLED = "not_started_cancelled";
    static final String NOT_STARTED_MEMORY_BUDGET = "not_started_memory_budget";
    static final String SITE_CRAWL_EXCEPTION = "site_crawl_exception";

    private final SiteCrawlerService siteCrawlerService;
    private final ProgressEventBus progressEventBus;
    private final ExecutorService siteExecutor;
    private final ExecutorService batchRunExecutor;
    private final FieldSchema defaultSchema;
    private final ExtractorProperties properties;

    public BatchSessionService(
        SiteCrawlerService siteCrawlerService,
        ProgressEventBus progressEventBus,
        @Qualifier("siteExecutor") ExecutorService siteExecutor,
        @Qualifier("batchRunExecutor") ExecutorService batchRunExecutor,
        FieldSchema defaultSchema,
        ExtractorProperties properties
    ) {
        this.siteCrawlerService = siteCrawlerService;
        this.progressEventBus = progressEventBus;
        this.siteExecutor = siteExecutor;
        this.batchRunExecutor = batchRunExecutor;
        this.defaultSchema = defaultSchema;
        this.properties = properties;
    }

    /** Runs {@code startUrls} with the configured settings and the default schema. */
    public BatchResult run(List<String> startUrls) {
        return run(new BatchRequest(startUrls, defaultSchema, CrawlSettings.from(properties)));
    }

    /**
     * Runs the batch on the calling thread and returns once every launched site has finished.
     *
     * @throws com.delta.siteextract.crawl.model.InvalidCrawlSettingsException before any site is
     *                                                                         contacted
     */
    public BatchResult run(BatchRequest request) {
        BatchRequest checked = checked(request);
        return execute(checked, new CancellationSignal());
    }

    /**
     * Starts the batch in the background. Settings are validated here, so a bad configuration
     * throws from this call rather than from the handle.
     */
    public BatchHandle start(BatchRequest request) {
        BatchRequest checked = checked(request);
        CancellationSignal cancellation = new CancellationSignal();
        CompletableFuture<BatchResult> result = CompletableFuture.supplyAsync(
            () -> execute(checked, cancellation),
            batchRunExecutor
        );
        return new BatchHandle(cancellation, result);
    }

    private BatchRequest checked(BatchRequest request) {
        Objects.requireNonNull(request, "request");
        CrawlSettings settings = request.settings() == null ? CrawlSettings.from(properties) : request.settings();
        settings.validate();
        FieldSchema schema = request.schema() == null ? defaultSchema : request.schema();
        return new BatchRequest(request.startUrls(), schema, settings);
    }

    BatchResult execute(BatchRequest request, CancellationSignal cancellation) {
        CrawlSettings settings = request.settings();
        List<String> startUrls = request.startUrls();
        Instant startedAt = Instant.now();
        ResourceBudget budget = new ResourceBudget(settings.memoryBudgetBytes());
        budget.sampleHeap();
        BatchProgressTracker tracker = new BatchProgressTracker(progressEventBus, startUrls.size());
        CrawlContext context = new CrawlContext(cancellation, tracker, budget);
        Semaphore permits = new Semaphore(settings.batchConcurrency());

        log.info(
            "batch started sites={} concurrency={} memoryBudgetBytes={}",
            startUrls.size(),
            settings.batchConcurrency(),
            settings.memoryBudgetBytes()
        );

        List<String> launchedUrls = new ArrayList<>();
        List<CompletableFuture<SiteCrawlResult>> futures = new ArrayList<>();
        List<SiteFailure> failures = new ArrayList<>();
        for (String startUrl : startUrls) {
            if (!acquire(permits, cancellation)) {
                failures.add(notStarted(startUrl, NOT_STARTED_CANCELLED, ErrorCategory.POLICY_BLOCKED));
                continue;
            }
            if (cancellation.isCancelled()) {
                permits.release();
                failures.add(notStarted(startUrl, NOT_STARTED_CANCELLED, ErrorCategory.POLICY_BLOCKED));
                continue;
            }
            if (budget.isExhausted()) {
                permits.release();
                log.warn("memory budget exhausted, not starting site={} usedBytes={}", startUrl, budget.usedBytes());
                failures.add(notStarted(startUrl, NOT_STARTED_MEMORY_BUDGET, ErrorCategory.POLICY_BLOCKED));
                continue;
            }
            launchedUrls.add(startUrl);
            futures.add(CompletableFuture
                .supplyAsync(() -> siteCrawlerService.crawl(startUrl, request.schema(), settings, context), siteExecutor)
                .whenComplete((result, error) -> permits.release()));
        }

        List<SiteCrawlResult> sites = new ArrayList<>();
        List<EntityRecord> records = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            String startUrl = launchedUrls.get(i);
            try {
                SiteCrawlResult site = futures.get(i).join();
                sites.add(site);
                if (site.state() == SiteState.DONE) {
                    succeeded++;
                    records.add(site.record());
                } else {
                    failed++;
                    failures.add(site.failure());
                }
            } catch (CompletionException e) {
                failed++;
                log.warn("Site crawl failed for {}", startUrl, e);
                failures.add(crashed(startUrl, e.getCause() == null ? e : e.getCause()));
                tracker.siteCompleted(startUrl, SiteState.FAILED, 0, 0);
            } catch (Exception e) {
                failed++;
                log.warn("Site crawl failed for {}", startUrl, e);
                failures.add(crashed(startUrl, e));
                tracker.siteCompleted(startUrl, SiteState.FAILED, 0, 0);
            }
        }

        budget.sampleHeap();
        int pagesProcessed = sites.stream().mapToInt(site -> site.statistics().pagesAttempted()).sum();
        int pagesFailed = sites.stream().mapToInt(site -> site.statistics().pagesFailed()).sum();
        long bytesFetched = sites.stream().mapToLong(site -> site.statistics().bytesFetched()).sum();
        BatchStatistics statistics = new BatchStatistics(
            futures.size(),
            succeeded,
            failed,
            startUrls.size() - futures.size(),
            pagesProcessed,
            pagesFailed,
            bytesFetched,
            Duration.between(startedAt, Instant.now()),
            budget.heapHighWaterBytes(),
            cancellation.isCancelled()
        );
        tracker.batchCompleted(pagesProcessed);
        log.info(
            "batch finished attempted={} succeeded={} failed={} notStarted={} pages={} bytes={} cancelled={} elapsedMs={}",
            statistics.sitesAttempted(),
            statistics.sitesSucceeded(),
            statistics.sitesFailed(),
            statistics.sitesNotStarted(),
            statistics.pagesProcessed(),
            statistics.bytesFetched(),
            statistics.cancelled(),
            statistics.elapsed().toMillis()
        );
        return new BatchResult(records, failures, sites, statistics);
    }

    private static boolean acquire(Semaphore permits, CancellationSignal cancellation) {
        try {
            permits.acquire();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            return false;
        }
    }

    private static SiteFailure notStarted(String startUrl, String reason, ErrorCategory category) {
        return new SiteFailure(startUrl, reason, category, null);
    }

    private static SiteFailure crashed(String startUrl, Throwable error) {
        return new SiteFailure(startUrl, SITE_CRAWL_EXCEPTION, ErrorCategory.EXTRACTION, error.getClass().getSimpleName());
    }
}
