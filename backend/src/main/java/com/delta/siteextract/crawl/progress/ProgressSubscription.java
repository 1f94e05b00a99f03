package com.delta.siteextract.crawl.progress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Bounded per-subscriber buffer. When full, the oldest event is dropped so that publishing
 * never waits on a slow consumer.
 */
public class ProgressSubscription implements AutoCloseable {
    private final int capacity;
    private final Deque<ProgressEvent> buffer;
    private final ProgressEventBus bus;
    private long dropped;
    private boolean closed;

    ProgressSubscription(ProgressEventBus bus, int capacity) {
        this.bus = bus;
        this.capacity = Math.max(1, capacity);
        this.buffer = new ArrayDeque<>(this.capacity);
    }

    synchronized void offer(ProgressEvent event) {
        if (closed) {
            return;
        }
        if (buffer.size() >= capacity) {
            buffer.pollFirst();
            dropped++;
        }
        buffer.addLast(event);
        notifyAll();
    }

    public synchronized ProgressEvent poll() {
        return buffer.pollFirst();
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, or {@code null} on timeout or once closed and drained
     */
    public synchronized ProgressEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (buffer.isEmpty() && !closed) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return null;
            }
            wait(remainingMs);
        }
        return buffer.pollFirst();
    }

    public synchronized List<ProgressEvent> drain() {
        List<ProgressEvent> out = new ArrayList<>(buffer);
        buffer.clear();
        return out;
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    public synchronized int capacity() {
        return capacity;
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
            notifyAll();
        }
        bus.unsubscribe(this);
    }
}
