package com.delta.siteextract.crawl.robots;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.delta.siteextract.config.ExtractorProperties;
import com.delta.siteextract.crawl.CrawlTestSupport;
import com.delta.siteextract.crawl.http.PoliteHttpClient;
import com.delta.siteextract.crawl.http.RequestPolicy;
import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.model.FetchFailure;
import com.delta.siteextract.crawl.model.FetchResult;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RobotsTxtServiceTest {

  @Mock private PoliteHttpClient httpClient;

  @Test
  void failClosedDisallowsCrawlWhenRobotsUnavailable() {
    when(httpClient.get(anyString(), any(RequestPolicy.class))).thenReturn(errorFetch());

    RobotsTxtService service = new RobotsTxtService(httpClient);

    assertFalse(service.isAllowed("https://example.com/menu", settings(false)));
  }

  @Test
  void failOpenAllowsCrawlWhenRobotsUnavailable() {
    when(httpClient.get(anyString(), any(RequestPolicy.class))).thenReturn(errorFetch());

    RobotsTxtService service = new RobotsTxtService(httpClient);

    assertTrue(service.isAllowed("https://example.com/menu", settings(true)));
  }

  @Test
  void missingRobotsAllowsEverythingEvenWhenFailClosed() {
    when(httpClient.get(anyString(), any(RequestPolicy.class)))
        .thenReturn(FetchResult.failed(
            "https://example.com/robots.txt", Instant.now(), 404, FetchFailure.httpError(404)));

    RobotsTxtService service = new RobotsTxtService(httpClient);

    assertTrue(service.isAllowed("https://example.com/menu", settings(false)));
  }

  @Test
  void parsedRulesAreCachedPerOrigin() {
    when(httpClient.get(eq("https://example.com/robots.txt"), any(RequestPolicy.class)))
        .thenReturn(robotsFetch("User-agent: *\nDisallow: /private\n"));

    RobotsTxtService service = new RobotsTxtService(httpClient);
    CrawlSettings settings = settings(true);

    assertFalse(service.isAllowed("https://example.com/private/room", settings));
    assertTrue(service.isAllowed("https://example.com/menu", settings));
    verify(httpClient, times(1)).get(eq("https://example.com/robots.txt"), any(RequestPolicy.class));
  }

  private CrawlSettings settings(boolean failOpen) {
    ExtractorProperties properties = CrawlTestSupport.fastProperties();
    properties.getRobots().setEnabled(true);
    properties.getRobots().setFailOpen(failOpen);
    return CrawlSettings.from(properties);
  }

  private FetchResult errorFetch() {
    return FetchResult.failed(
        "https://example.com/robots.txt",
        Instant.now(),
        0,
        FetchFailure.networkError("connection_refused: connection failed"));
  }

  private FetchResult robotsFetch(String body) {
    return new FetchResult(
        "https://example.com/robots.txt",
        URI.create("https://example.com/robots.txt"),
        200,
        body,
        "text/plain",
        Instant.now(),
        Duration.ofMillis(5),
        1,
        null);
  }
}
