package com.delta.siteextract.crawl.http;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-domain request clock shared by every site crawl in the process. Callers block until the
 * domain is eligible; requests are never dropped.
 */
@Component
public class DomainRateLimiter {
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    /**
     * Waits until {@code hostKey} may be contacted again, then reserves the next slot
     * {@code interval} from now.
     */
    public void awaitTurn(String hostKey, Duration interval) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(hostKey, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(hostKey, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            long intervalMs = interval == null ? 0L : Math.max(0L, interval.toMillis());
            hostNextAllowed.put(hostKey, Instant.now().plusMillis(intervalMs));
        }
    }

    public void extendBackoff(String hostKey, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(hostKey, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(hostKey, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(hostKey, candidate);
            }
        }
    }

    public Instant nextAllowedAt(String hostKey) {
        return hostNextAllowed.get(hostKey);
    }
}
