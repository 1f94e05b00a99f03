package com.delta.siteextract.crawl.progress;

import com.delta.siteextract.crawl.CrawlTestSupport;
import com.delta.siteextract.crawl.model.PageStatus;
import com.delta.siteextract.crawl.model.PageType;
import com.delta.siteextract.crawl.model.SiteState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressEventBusTest {

    @Test
    void fullBufferDropsTheOldestEvents() {
        ProgressEventBus bus = new ProgressEventBus(CrawlTestSupport.fastProperties());
        BatchProgressTracker tracker = new BatchProgressTracker(bus, 3);

        try (ProgressSubscription subscription = bus.subscribe(2)) {
            tracker.siteStarted("https://a.example/");
            tracker.siteStarted("https://b.example/");
            tracker.siteStarted("https://c.example/");

            List<ProgressEvent> events = subscription.drain();
            assertThat(events).extracting(ProgressEvent::siteUrl)
                .containsExactly("https://b.example/", "https://c.example/");
            assertThat(subscription.droppedCount()).isEqualTo(1);
        }
    }

    @Test
    void slowSubscriberDoesNotAffectOthers() {
        ProgressEventBus bus = new ProgressEventBus(CrawlTestSupport.fastProperties());
        BatchProgressTracker tracker = new BatchProgressTracker(bus, 1);

        try (ProgressSubscription small = bus.subscribe(1); ProgressSubscription large = bus.subscribe(16)) {
            tracker.siteStarted("https://a.example/");
            tracker.pageStarted("https://a.example/", "https://a.example/", 0, 1);
            tracker.pageCompleted("https://a.example/", "https://a.example/", PageType.HOME, PageStatus.SUCCESS, 1, 1);

            assertThat(small.drain()).hasSize(1);
            assertThat(large.drain()).extracting(ProgressEvent::type).containsExactly(
                ProgressEventType.SITE_STARTED,
                ProgressEventType.PAGE_STARTED,
                ProgressEventType.PAGE_COMPLETED
            );
        }
    }

    @Test
    void eventsCarryBatchCounters() {
        ProgressEventBus bus = new ProgressEventBus(CrawlTestSupport.fastProperties());
        BatchProgressTracker tracker = new BatchProgressTracker(bus, 2);

        try (ProgressSubscription subscription = bus.subscribe()) {
            tracker.pageCompleted("https://a.example/", "https://a.example/menu", PageType.MENU, PageStatus.TIMEOUT, 2, 3);
            tracker.siteCompleted("https://a.example/", SiteState.DONE, 3, 3);

            List<ProgressEvent> events = subscription.drain();
            assertThat(events.get(0).status()).isEqualTo("timeout");
            assertThat(events.get(0).pageType()).isEqualTo(PageType.MENU);
            assertThat(events.get(0).pagesCompleted()).isEqualTo(2);
            assertThat(events.get(0).sitesCompleted()).isZero();
            assertThat(events.get(1).status()).isEqualTo("DONE");
            assertThat(events.get(1).sitesCompleted()).isEqualTo(1);
            assertThat(events.get(1).sitesTotal()).isEqualTo(2);
        }
    }

    @Test
    void closedSubscriptionStopsReceiving() throws Exception {
        ProgressEventBus bus = new ProgressEventBus(CrawlTestSupport.fastProperties());
        BatchProgressTracker tracker = new BatchProgressTracker(bus, 1);
        ProgressSubscription subscription = bus.subscribe();

        subscription.close();
        tracker.siteStarted("https://a.example/");

        assertThat(bus.subscriberCount()).isZero();
        assertThat(subscription.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void detachedTrackerPublishesNothing() {
        BatchProgressTracker tracker = BatchProgressTracker.detached();

        tracker.siteStarted("https://a.example/");
        tracker.siteCompleted("https://a.example/", SiteState.FAILED, 0, 0);

        assertThat(tracker.sitesCompleted()).isEqualTo(1);
    }
}
