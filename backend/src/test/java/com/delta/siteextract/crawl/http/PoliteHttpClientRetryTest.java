package com.delta.siteextract.crawl.http;

import com.delta.siteextract.crawl.CrawlTestSupport;
import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.model.FailureKind;
import com.delta.siteextract.crawl.model.FetchResult;
import com.delta.siteextract.crawl.util.FailureClassifier;
import com.delta.siteextract.crawl.util.UrlNormalizer;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void retriesServerErrorsThenSucceeds() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));
        server.start();

        PoliteHttpClient client = client();
        FetchResult result = client.get(server.url("/menu").toString(), policy());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).contains("ok");
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryClientErrors() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404));
        server.start();

        FetchResult result = client().get(server.url("/missing").toString(), policy());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.failure().errorKey()).isEqualTo("http_404");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void givesUpAfterMaxRetries() throws Exception {
        server = new MockWebServer();
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }
        server.start();

        FetchResult result = client().get(server.url("/flaky").toString(), policy());

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void timeoutIsRecordedWithoutRetry() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        server.enqueue(new MockResponse().setBody("never reached"));
        server.start();

        FetchResult result = client().get(
            server.url("/slow").toString(),
            policy().withTimeout(Duration.ofMillis(500))
        );

        assertThat(result.failure().kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void connectionRefusedIsRetriedAndReported() throws Exception {
        server = new MockWebServer();
        server.start();
        String url = server.url("/").toString();
        server.shutdown();
        server = null;

        FetchResult result = client().get(url, policy());

        assertThat(result.failure().kind()).isEqualTo(FailureKind.NETWORK_ERROR);
        assertThat(result.failure().detail()).startsWith(FailureClassifier.CONNECTION_REFUSED);
        assertThat(result.attempts()).isEqualTo(3);
    }

    @Test
    void rateLimitResponseBacksOffTheHost() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "1"));
        server.enqueue(new MockResponse().setBody("<html>ok</html>"));
        server.start();

        executor = Executors.newFixedThreadPool(2);
        DomainRateLimiter limiter = new DomainRateLimiter();
        PoliteHttpClient client = new PoliteHttpClient(executor, limiter);
        String url = server.url("/menu").toString();

        Instant before = Instant.now();
        FetchResult result = client.get(url, policy());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(Duration.between(before, Instant.now())).isGreaterThanOrEqualTo(Duration.ofMillis(900));
        assertThat(limiter.nextAllowedAt(UrlNormalizer.hostKey(url))).isNotNull();
    }

    private PoliteHttpClient client() {
        executor = Executors.newFixedThreadPool(2);
        return CrawlTestSupport.httpClient(executor);
    }

    private RequestPolicy policy() {
        CrawlSettings settings = CrawlSettings.from(CrawlTestSupport.fastProperties());
        return RequestPolicy.forPage(settings, Duration.ofSeconds(5), Duration.ZERO);
    }
}
