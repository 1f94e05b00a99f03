package com.delta.siteextract.crawl.progress;

import com.delta.siteextract.config.ExtractorProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One-way progress channel from site crawls to any number of subscribers.
 */
@Component
public class ProgressEventBus {
    private final int defaultCapacity;
    private final List<ProgressSubscription> subscriptions = new CopyOnWriteArrayList<>();

    public ProgressEventBus(ExtractorProperties properties) {
        this.defaultCapacity = properties.getProgressBufferSize();
    }

    public ProgressSubscription subscribe() {
        return subscribe(defaultCapacity);
    }

    public ProgressSubscription subscribe(int capacity) {
        ProgressSubscription subscription = new ProgressSubscription(this, capacity);
        subscriptions.add(subscription);
        return subscription;
    }

    public void publish(ProgressEvent event) {
        for (ProgressSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    void unsubscribe(ProgressSubscription subscription) {
        subscriptions.remove(subscription);
    }
}
