package com.delta.siteextract.crawl.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DomainRateLimiterTest {

    @Test
    void spacesRequestsToTheSameHost() throws Exception {
        DomainRateLimiter limiter = new DomainRateLimiter();
        Instant start = Instant.now();

        limiter.awaitTurn("example.com", Duration.ofMillis(200));
        limiter.awaitTurn("example.com", Duration.ofMillis(200));
        limiter.awaitTurn("example.com", Duration.ofMillis(200));

        assertThat(Duration.between(start, Instant.now())).isGreaterThanOrEqualTo(Duration.ofMillis(390));
    }

    @Test
    void hostsAreIndependent() throws Exception {
        DomainRateLimiter limiter = new DomainRateLimiter();
        limiter.awaitTurn("a.example", Duration.ofSeconds(5));
        Instant start = Instant.now();

        limiter.awaitTurn("b.example", Duration.ofSeconds(5));

        assertThat(Duration.between(start, Instant.now())).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void backoffOnlyExtendsTheNextSlot() {
        DomainRateLimiter limiter = new DomainRateLimiter();
        limiter.extendBackoff("example.com", Duration.ofSeconds(10));
        Instant extended = limiter.nextAllowedAt("example.com");

        limiter.extendBackoff("example.com", Duration.ofSeconds(1));

        assertThat(limiter.nextAllowedAt("example.com")).isEqualTo(extended);
    }
}
