package com.delta.siteextract.crawl.service;

import com.delta.siteextract.crawl.aggregate.DataAggregator;
import com.delta.siteextract.crawl.discovery.LinkFilter;
import com.delta.siteextract.crawl.discovery.PageClassifier;
import com.delta.siteextract.crawl.discovery.PageTypeRules;
import com.delta.siteextract.crawl.extraction.ExtractionEngine;
import com.delta.siteextract.crawl.extraction.PageContent;
import com.delta.siteextract.crawl.http.PageFetcher;
import com.delta.siteextract.crawl.model.Classification;
import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.model.EntityRecord;
import com.delta.siteextract.crawl.model.ErrorCategory;
import com.delta.siteextract.crawl.model.FailureKind;
import com.delta.siteextract.crawl.model.FetchResult;
import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.FieldValue;
import com.delta.siteextract.crawl.model.PageResult;
import com.delta.siteextract.crawl.model.PageStatus;
import com.delta.siteextract.crawl.model.PageTask;
import com.delta.siteextract.crawl.model.PageType;
import com.delta.siteextract.crawl.model.SiteCrawlResult;
import com.delta.siteextract.crawl.model.SiteFailure;
import com.delta.siteextract.crawl.model.SiteState;
import com.delta.siteextract.crawl.model.SiteStatistics;
import com.delta.siteextract.crawl.model.StopReason;
import com.delta.siteextract.crawl.util.FailureClassifier;
import com.delta.siteextract.crawl.util.HashUtils;
import com.delta.siteextract.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Crawls one site breadth-first from its start URL and folds the pages into an
 * {@link EntityRecord}.
 *
 * <p>State flow: DISCOVERING (start page) then CRAWLING (queue) then AGGREGATING then DONE.
 * A start page that cannot be fetched ends the crawl in FAILED. Pages of one site are fetched
 * sequentially; concurrency happens across sites.
 */
@Service
public class SiteCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(SiteCrawlerService.class);
    private static final Duration MIN_PAGE_TIMEOUT = Duration.ofMillis(50);

    private final PageFetcher pageFetcher;
    private final PageClassifier pageClassifier;
    private final ExtractionEngine extractionEngine;
    private final DataAggregator dataAggregator;
    private final PageTypeRules pageTypeRules;

    public SiteCrawlerService(
        PageFetcher pageFetcher,
        PageClassifier pageClassifier,
        ExtractionEngine extractionEngine,
        DataAggregator dataAggregator,
        PageTypeRules pageTypeRules
    ) {
        this.pageFetcher = pageFetcher;
        this.pageClassifier = pageClassifier;
        this.extractionEngine = extractionEngine;
        this.dataAggregator = dataAggregator;
        this.pageTypeRules = pageTypeRules;
    }

    public SiteCrawlResult crawl(String startUrl, FieldSchema schema, CrawlSettings settings) {
        return crawl(startUrl, schema, settings, CrawlContext.standalone(settings.memoryBudgetBytes()));
    }

    public SiteCrawlResult crawl(String startUrl, FieldSchema schema, CrawlSettings settings, CrawlContext context) {
        String rootUrl = UrlNormalizer.normalize(startUrl);
        SiteCrawlState state = new SiteCrawlState(
            startUrl,
            rootUrl,
            settings.maxPagesPerSite(),
            settings.maxCrawlDepth(),
            settings.siteTimeout()
        );
        context.progress().siteStarted(startUrl);
        log.info("site crawl started site={} maxPages={} maxDepth={}", startUrl, settings.maxPagesPerSite(), settings.maxCrawlDepth());

        if (rootUrl == null) {
            SiteFailure failure = new SiteFailure(startUrl, "invalid_start_url", ErrorCategory.PERMANENT_FETCH, startUrl);
            return fail(state, failure, StopReason.START_PAGE_FAILED, context);
        }

        state.useLinkFilter(new LinkFilter(state.rootUrl(), settings, pageTypeRules));
        state.tryEnqueue(PageTask.seed(state.rootUrl()));
        PageResult startPage = processPage(state.poll(), state, schema, settings, context);
        if (!startPage.isSuccessful()) {
            String reason = "start_page_failed:" + startPage.errorDetail();
            SiteFailure failure = new SiteFailure(startUrl, reason, startPage.errorCategory(), startPage.errorDetail());
            return fail(state, failure, StopReason.START_PAGE_FAILED, context);
        }

        state.transition(SiteState.CRAWLING);
        StopReason stopReason = crawlQueue(state, schema, settings, context);
        if (stopReason == StopReason.SITE_TIMEOUT && state.succeededCount() == 0) {
            SiteFailure failure = new SiteFailure(startUrl, "site_timeout", ErrorCategory.TIMEOUT, null);
            return fail(state, failure, stopReason, context);
        }

        state.transition(SiteState.AGGREGATING);
        EntityRecord record = dataAggregator.aggregate(startUrl, state.results(), schema);
        state.transition(SiteState.DONE);
        SiteStatistics statistics = statistics(state, stopReason);
        context.progress().siteCompleted(startUrl, SiteState.DONE, state.completedCount(), state.enqueuedCount());
        log.info(
            "site crawl done site={} pages={} succeeded={} failed={} skipped={} stop={} confidence={} durationMs={}",
            startUrl,
            statistics.pagesAttempted(),
            statistics.pagesSucceeded(),
            statistics.pagesFailed(),
            statistics.pagesSkipped(),
            stopReason,
            String.format(Locale.ROOT, "%.2f", record.confidence()),
            statistics.duration().toMillis()
        );
        return new SiteCrawlResult(startUrl, SiteState.DONE, record, state.results(), statistics, null);
    }

    private StopReason crawlQueue(
        SiteCrawlState state,
        FieldSchema schema,
        CrawlSettings settings,
        CrawlContext context
    ) {
        while (state.hasPending()) {
            if (context.cancellation().isCancelled()) {
                log.info("site crawl cancelled site={} pagesCompleted={}", state.siteUrl(), state.completedCount());
                return StopReason.CANCELLED;
            }
            if (state.isPastDeadline()) {
                log.warn("site timeout reached site={} pagesCompleted={}", state.siteUrl(), state.completedCount());
                return StopReason.SITE_TIMEOUT;
            }
            processPage(state.poll(), state, schema, settings, context);
        }
        return state.enqueuedCount() >= settings.maxPagesPerSite()
            ? StopReason.PAGE_LIMIT
            : StopReason.QUEUE_EXHAUSTED;
    }

    private PageResult processPage(
        PageTask task,
        SiteCrawlState state,
        FieldSchema schema,
        CrawlSettings settings,
        CrawlContext context
    ) {
        int sequence = state.nextSequence();
        context.progress().pageStarted(state.siteUrl(), task.url(), state.completedCount(), state.enqueuedCount());
        Instant startedAt = Instant.now();

        PageResult result;
        try {
            FetchResult fetch = pageFetcher.fetch(task.url(), pageTimeout(state, settings), settings);
            result = fetch.isSuccessful()
                ? handleFetched(task, sequence, fetch, state, schema)
                : failedFetch(task, sequence, fetch);
        } catch (RuntimeException e) {
            log.warn("page processing failed site={} url={}", state.siteUrl(), task.url(), e);
            result = PageResult.failed(
                task,
                sequence,
                PageStatus.FAILED,
                null,
                Duration.between(startedAt, Instant.now()),
                ErrorCategory.EXTRACTION,
                e.getClass().getSimpleName()
            );
        }

        state.record(result);
        context.budget().recordBytes(result.bytesFetched());
        context.progress().pageCompleted(
            state.siteUrl(),
            task.url(),
            result.pageType(),
            result.status(),
            state.completedCount(),
            state.enqueuedCount()
        );
        return result;
    }

    private PageResult handleFetched(
        PageTask task,
        int sequence,
        FetchResult fetch,
        SiteCrawlState state,
        FieldSchema schema
    ) {
        String finalUrl = UrlNormalizer.normalize(fetch.finalUrlOrRequested());
        if (finalUrl == null) {
            finalUrl = task.url();
        }
        if (!finalUrl.equals(task.url()) && state.isKnown(finalUrl)) {
            log.debug("redirect to known url skipped site={} url={} finalUrl={}", state.siteUrl(), task.url(), finalUrl);
            return skipped(task, sequence, fetch, "redirect_duplicate:" + finalUrl);
        }
        state.markKnown(finalUrl);
        if (task.depth() == 0 && !state.linkFilter().isInternal(finalUrl)) {
            log.debug("start page redirected site={} finalUrl={}", state.siteUrl(), finalUrl);
            state.useLinkFilter(state.linkFilter().withSiteRoot(finalUrl));
        }

        if (!isHtml(fetch.contentType())) {
            return new PageResult(
                task,
                sequence,
                PageStatus.FAILED,
                fetch.statusCodeOrNull(),
                task.pageTypeHint(),
                Map.of(),
                List.of(),
                fetch.duration(),
                fetch.bodyLength(),
                ErrorCategory.PERMANENT_FETCH,
                "unsupported_content_type:" + fetch.contentType()
            );
        }
        if (!state.addFingerprint(HashUtils.contentFingerprint(fetch.body()))) {
            log.debug("duplicate content skipped site={} url={}", state.siteUrl(), task.url());
            return skipped(task, sequence, fetch, "content_duplicate");
        }

        PageContent content = PageContent.parse(finalUrl, fetch.body());
        PageType pageType;
        List<String> enqueued = new ArrayList<>();
        if (state.canFollowFrom(task)) {
            Classification classification = pageClassifier.classify(
                finalUrl,
                content.document(),
                state.linkFilter(),
                state.knownUrls(),
                state.remainingCapacity()
            );
            pageType = classification.pageType();
            for (String link : classification.discoveredLinks()) {
                if (state.tryEnqueue(task.child(link))) {
                    enqueued.add(link);
                }
            }
            if (classification.droppedLinks() > 0) {
                log.debug("page budget reached site={} url={} droppedLinks={}", state.siteUrl(), finalUrl, classification.droppedLinks());
            }
        } else {
            pageType = pageClassifier.classifyType(finalUrl, content.document());
        }

        Map<String, List<FieldValue>> fields = extractionEngine.extract(content, schema);
        log.debug(
            "page processed site={} url={} type={} fields={} links={}",
            state.siteUrl(),
            finalUrl,
            pageType.label(),
            fields.size(),
            enqueued.size()
        );
        return new PageResult(
            task.withPageType(pageType),
            sequence,
            PageStatus.SUCCESS,
            fetch.statusCodeOrNull(),
            pageType,
            fields,
            enqueued,
            fetch.duration(),
            fetch.bodyLength(),
            null,
            null
        );
    }

    private PageResult failedFetch(PageTask task, int sequence, FetchResult fetch) {
        PageStatus status = fetch.failure() != null && fetch.failure().kind() == FailureKind.TIMEOUT
            ? PageStatus.TIMEOUT
            : PageStatus.FAILED;
        ErrorCategory category = fetch.failure() == null
            ? ErrorCategory.PERMANENT_FETCH
            : FailureClassifier.categorize(fetch.failure());
        String detail = fetch.failure() == null ? "http_" + fetch.statusCode() : fetch.failure().errorKey();
        return PageResult.failed(task, sequence, status, fetch.statusCodeOrNull(), fetch.duration(), category, detail);
    }

    private PageResult skipped(PageTask task, int sequence, FetchResult fetch, String detail) {
        return new PageResult(
            task,
            sequence,
            PageStatus.SKIPPED_DUPLICATE,
            fetch.statusCodeOrNull(),
            task.pageTypeHint(),
            Map.of(),
            List.of(),
            fetch.duration(),
            fetch.bodyLength(),
            null,
            detail
        );
    }

    private SiteCrawlResult fail(SiteCrawlState state, SiteFailure failure, StopReason stopReason, CrawlContext context) {
        state.transition(SiteState.FAILED);
        context.progress().siteCompleted(state.siteUrl(), SiteState.FAILED, state.completedCount(), state.enqueuedCount());
        log.warn("site crawl failed site={} reason={} category={}", state.siteUrl(), failure.reason(), failure.category());
        return new SiteCrawlResult(
            state.siteUrl(),
            SiteState.FAILED,
            null,
            state.results(),
            statistics(state, stopReason),
            failure
        );
    }

    private static SiteStatistics statistics(SiteCrawlState state, StopReason stopReason) {
        return new SiteStatistics(
            state.completedCount(),
            state.succeededCount(),
            state.failedCount(),
            state.skippedCount(),
            state.bytesFetched(),
            Duration.between(state.startedAt(), Instant.now()),
            stopReason
        );
    }

    private static Duration pageTimeout(SiteCrawlState state, CrawlSettings settings) {
        Duration remaining = state.remainingTime();
        Duration timeout = remaining.compareTo(settings.pageTimeout()) < 0 ? remaining : settings.pageTimeout();
        return timeout.compareTo(MIN_PAGE_TIMEOUT) < 0 ? MIN_PAGE_TIMEOUT : timeout;
    }

    private static boolean isHtml(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("html") || lower.contains("xml") || lower.startsWith("text/");
    }
}
