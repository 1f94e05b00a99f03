package com.delta.siteextract.crawl.http;

import com.delta.siteextract.config.ExtractorProperties;
import com.delta.siteextract.crawl.CrawlTestSupport;
import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.model.FailureKind;
import com.delta.siteextract.crawl.model.FetchResult;
import com.delta.siteextract.crawl.robots.RobotsTxtService;
import com.delta.siteextract.crawl.util.FailureClassifier;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherTest {
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
    void robotsDisallowedPageIsNeverRequested() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("/robots.txt".equals(request.getPath())) {
                    return new MockResponse().setBody("User-agent: *\nDisallow: /private\n");
                }
                return new MockResponse().setBody("<html><body>page</body></html>");
            }
        });
        server.start();

        PageFetcher fetcher = fetcher();
        CrawlSettings settings = robotsSettings();

        FetchResult blocked = fetcher.fetch(server.url("/private/menu").toString(), Duration.ofSeconds(5), settings);
        FetchResult allowed = fetcher.fetch(server.url("/menu").toString(), Duration.ofSeconds(5), settings);

        assertThat(blocked.failure().kind()).isEqualTo(FailureKind.BLOCKED);
        assertThat(blocked.failure().detail()).isEqualTo(FailureClassifier.ROBOTS_DISALLOWED);
        assertThat(allowed.isSuccessful()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);
        assertThat(server.takeRequest().getPath()).isEqualTo("/robots.txt");
        assertThat(server.takeRequest().getPath()).isEqualTo("/menu");
    }

    @Test
    void rejectsUrlsThatAreNotAbsoluteHttp() {
        executor = Executors.newFixedThreadPool(1);
        PageFetcher fetcher = fetcher();

        FetchResult result = fetcher.fetch("ftp://example.com/menu", Duration.ofSeconds(1), robotsSettings());

        assertThat(result.failure().kind()).isEqualTo(FailureKind.INVALID_URL);
    }

    @Test
    void sendsConfiguredUserAgent() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setBody("<html></html>"));
        server.start();

        ExtractorProperties properties = CrawlTestSupport.fastProperties();
        properties.setUserAgent("menu-bot/2.0");
        fetcher().fetch(server.url("/").toString(), Duration.ofSeconds(5), CrawlSettings.from(properties));

        assertThat(server.takeRequest().getHeader("User-Agent")).isEqualTo("menu-bot/2.0");
    }

    private PageFetcher fetcher() {
        if (executor == null) {
            executor = Executors.newFixedThreadPool(2);
        }
        PoliteHttpClient httpClient = CrawlTestSupport.httpClient(executor);
        return new PageFetcher(httpClient, new RobotsTxtService(httpClient));
    }

    private CrawlSettings robotsSettings() {
        ExtractorProperties properties = CrawlTestSupport.fastProperties();
        properties.getRobots().setEnabled(true);
        return CrawlSettings.from(properties);
    }
}
