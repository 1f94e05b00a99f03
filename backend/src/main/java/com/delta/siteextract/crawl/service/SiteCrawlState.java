package com.delta.siteextract.crawl.service;

import com.delta.siteextract.crawl.discovery.LinkFilter;
import com.delta.siteextract.crawl.model.PageResult;
import com.delta.siteextract.crawl.model.PageStatus;
import com.delta.siteextract.crawl.model.PageTask;
import com.delta.siteextract.crawl.model.SiteState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bookkeeping for one site crawl. Owned by a single crawl thread; not shared.
 */
class SiteCrawlState {
    private final String siteUrl;
    private final String rootUrl;
    private final int maxPages;
    private final int maxDepth;
    private final Instant startedAt;
    private final Instant deadline;
    private final Set<String> known = new LinkedHashSet<>();
    private final Deque<PageTask> queue = new ArrayDeque<>();
    private final List<PageResult> results = new ArrayList<>();
    private final Set<String> fingerprints = new HashSet<>();
    private LinkFilter linkFilter;
    private SiteState state = SiteState.DISCOVERING;
    private int enqueued;
    private int sequence;
    private long bytesFetched;

    SiteCrawlState(String siteUrl, String rootUrl, int maxPages, int maxDepth, Duration siteTimeout) {
        this.siteUrl = siteUrl;
        this.rootUrl = rootUrl;
        this.maxPages = maxPages;
        this.maxDepth = maxDepth;
        this.startedAt = Instant.now();
        this.deadline = startedAt.plus(siteTimeout);
    }

    /**
     * Queues {@code task} unless its URL is already known, it is deeper than allowed, or the
     * page budget is spent.
     */
    boolean tryEnqueue(PageTask task) {
        if (task.depth() > maxDepth || enqueued >= maxPages || known.contains(task.url())) {
            return false;
        }
        known.add(task.url());
        queue.addLast(task);
        enqueued++;
        return true;
    }

    PageTask poll() {
        return queue.pollFirst();
    }

    boolean hasPending() {
        return !queue.isEmpty();
    }

    void markKnown(String url) {
        if (url != null) {
            known.add(url);
        }
    }

    boolean isKnown(String url) {
        return known.contains(url);
    }

    Set<String> knownUrls() {
        return Collections.unmodifiableSet(known);
    }

    boolean addFingerprint(String fingerprint) {
        return fingerprints.add(fingerprint);
    }

    int nextSequence() {
        return sequence++;
    }

    void record(PageResult result) {
        results.add(result);
        bytesFetched += result.bytesFetched();
    }

    int remainingCapacity() {
        return Math.max(0, maxPages - enqueued);
    }

    boolean canFollowFrom(PageTask task) {
        return task.depth() < maxDepth && remainingCapacity() > 0;
    }

    boolean isPastDeadline() {
        return !Instant.now().isBefore(deadline);
    }

    Duration remainingTime() {
        Duration remaining = Duration.between(Instant.now(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    int completedCount() {
        return results.size();
    }

    int succeededCount() {
        return (int) results.stream().filter(PageResult::isSuccessful).count();
    }

    int failedCount() {
        return (int) results.stream()
            .filter(result -> result.status() == PageStatus.FAILED || result.status() == PageStatus.TIMEOUT)
            .count();
    }

    int skippedCount() {
        return (int) results.stream().filter(result -> result.status() == PageStatus.SKIPPED_DUPLICATE).count();
    }

    String siteUrl() {
        return siteUrl;
    }

    String rootUrl() {
        return rootUrl;
    }

    LinkFilter linkFilter() {
        return linkFilter;
    }

    void useLinkFilter(LinkFilter linkFilter) {
        this.linkFilter = linkFilter;
    }

    int enqueuedCount() {
        return enqueued;
    }

    List<PageResult> results() {
        return List.copyOf(results);
    }

    long bytesFetched() {
        return bytesFetched;
    }

    Instant startedAt() {
        return startedAt;
    }

    SiteState state() {
        return state;
    }

    void transition(SiteState next) {
        this.state = next;
    }
}
