package com.marketwatch.tracker.scrape.http;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ScraperProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new ScraperProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setUserAgent("market-watch-test/1.0");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void getSendsPoliteHeadersAndReturnsBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<html>検索結果</html>"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/search").toString(), "text/html", "https://example.test/", new CancellationToken());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>検索結果</html>");
        assertThat(result.contentType()).startsWith("text/html");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).isEqualTo("market-watch-test/1.0");
        assertThat(request.getHeader("Accept-Language")).startsWith("ja-JP");
        assertThat(request.getHeader("Referer")).isEqualTo("https://example.test/");
    }

    @Test
    void errorStatusIsReturnedNotThrown() {
        server.enqueue(new MockResponse().setResponseCode(429));
        properties.setBlockedBackoffSeconds(0);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/busy").toString(), "text/html", null, null);

        assertThat(result.errorCode()).isNull();
        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void cancellationAbortsInFlightRequest() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("late")
            .setHeadersDelay(10, TimeUnit.SECONDS));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
        try {
            canceller.schedule(() -> token.cancel("cycle cancelled"), 200, TimeUnit.MILLISECONDS);
            long started = System.nanoTime();

            HttpFetchResult result = client.get(server.url("/slow").toString(), "text/html", null, token);

            assertThat(result.errorCode()).isEqualTo("cancelled");
            assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started)).isLessThan(5);
        } finally {
            canceller.shutdownNow();
        }
    }

    @Test
    void cancellationInterruptsBlockedBackoffWithoutSending() {
        server.enqueue(new MockResponse().setResponseCode(403));
        properties.setBlockedBackoffSeconds(5);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);
        String url = server.url("/search").toString();

        HttpFetchResult blocked = client.get(url, "text/html", null, new CancellationToken());
        assertThat(blocked.statusCode()).isEqualTo(403);

        CancellationToken token = new CancellationToken();
        ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
        try {
            canceller.schedule(() -> token.cancel("cycle cancelled"), 200, TimeUnit.MILLISECONDS);
            long started = System.nanoTime();

            HttpFetchResult result = client.get(url, "text/html", null, token);

            assertThat(result.errorCode()).isEqualTo("cancelled");
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(2000);
            assertThat(server.getRequestCount()).isEqualTo(1);
        } finally {
            canceller.shutdownNow();
        }
    }

    @Test
    void rotatesUserAgentFromPoolWhenNoneIsPinned() throws Exception {
        properties.setUserAgent(null);
        properties.setUserAgents(List.of("agent-a/1.0", "agent-b/1.0"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
            client.get(server.url("/page").toString(), "text/html", null, null);
            seen.add(server.takeRequest(1, TimeUnit.SECONDS).getHeader("User-Agent"));
        }

        assertThat(seen).isSubsetOf("agent-a/1.0", "agent-b/1.0").hasSize(2);
    }

    @Test
    void alreadyCancelledTokenSkipsRequest() {
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);
        CancellationToken token = new CancellationToken();
        token.cancel("stop");

        HttpFetchResult result = client.get(server.url("/never").toString(), "text/html", null, token);

        assertThat(result.errorCode()).isEqualTo("cancelled");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void malformedUrlIsRejected() {
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get("http://", "text/html", null, null);

        assertThat(result.errorCode()).isEqualTo("invalid_url");
    }

    @Test
    void postJsonSendsBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.postJson(server.url("/hook").toString(), "{\"content\":\"hi\"}", null);

        assertThat(result.statusCode()).isEqualTo(204);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"content\":\"hi\"}");
    }
}
