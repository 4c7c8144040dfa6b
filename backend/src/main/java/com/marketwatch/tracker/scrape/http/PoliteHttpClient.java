package com.marketwatch.tracker.scrape.http;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final int PER_HOST_CONCURRENCY = 2;
    private static final long PERMIT_POLL_MILLIS = 200;

    private final ScraperProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(ScraperProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader, String referer, CancellationToken cancellation) {
        return execute(url, "GET", acceptHeader, referer, null, cancellation);
    }

    public HttpFetchResult postJson(String url, String jsonBody, CancellationToken cancellation) {
        return execute(url, "POST", "application/json", null, jsonBody == null ? "" : jsonBody, cancellation);
    }

    private HttpFetchResult execute(
        String url,
        String method,
        String acceptHeader,
        String referer,
        String body,
        CancellationToken cancellation
    ) {
        Instant startedAt = Instant.now();
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        if (token.isCancelled()) {
            return errorResult(url, startedAt, "cancelled", token.reason());
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            acquired = acquirePermit(globalLimiter, token);
            if (!acquired) {
                return errorResult(url, startedAt, "cancelled", token.reason());
            }
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(host, ignored -> new Semaphore(PER_HOST_CONCURRENCY));
            hostAcquired = acquirePermit(hostLimiter, token);
            if (!hostAcquired) {
                return errorResult(url, startedAt, "cancelled", token.reason());
            }
            if (token.await(reservePerHostSlot(host))) {
                return errorResult(url, startedAt, "cancelled", token.reason());
            }

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.nextUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", properties.getAcceptLanguage());
            if (referer != null && !referer.isBlank()) {
                builder.header("Referer", referer);
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            if (token.isCancelled()) {
                return errorResult(url, startedAt, "cancelled", token.reason());
            }
            CompletableFuture<HttpResponse<byte[]>> future =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
            HttpResponse<byte[]> response;
            try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
                response = future.get(properties.getRequestTimeoutSeconds() + 5L, TimeUnit.SECONDS);
            }
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                log.warn("blocked response {} from {}; backing off host", response.statusCode(), host);
                extendBackoff(host, Duration.ofSeconds(properties.getBlockedBackoffSeconds()));
            }
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (CancellationException e) {
            return errorResult(url, startedAt, "cancelled", token.reason());
        } catch (TimeoutException e) {
            return errorResult(url, startedAt, "timeout", "no response within request timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return errorResult(url, startedAt, "timeout", cause.getMessage());
            }
            if (cause instanceof IOException) {
                return errorResult(url, startedAt, "io_error", cause.getMessage());
            }
            return errorResult(url, startedAt, "http_error", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, token.isCancelled() ? "cancelled" : "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private boolean acquirePermit(Semaphore semaphore, CancellationToken token) throws InterruptedException {
        while (!semaphore.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (token.isCancelled()) {
                return false;
            }
        }
        if (token.isCancelled()) {
            semaphore.release();
            return false;
        }
        return true;
    }

    /**
     * Claims the next send time for the host and returns how long the caller must wait for it.
     * The wait happens outside the host lock.
     */
    private Duration reservePerHostSlot(String host) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            Instant sendAt = allowedAt.isAfter(now) ? allowedAt : now;
            hostNextAllowed.put(host, sendAt.plusMillis(properties.getPerHostDelayMs()));
            return Duration.between(now, sendAt);
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
