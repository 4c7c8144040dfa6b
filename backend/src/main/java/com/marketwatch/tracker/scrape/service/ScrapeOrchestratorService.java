package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;
import com.marketwatch.tracker.scrape.adapter.AdapterException;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.adapter.SiteAdapter;
import com.marketwatch.tracker.scrape.adapter.SiteAdapterRegistry;
import com.marketwatch.tracker.scrape.guard.SiteGuard;
import com.marketwatch.tracker.scrape.guard.SiteGuardRegistry;
import com.marketwatch.tracker.scrape.model.AdapterOutcome;
import com.marketwatch.tracker.scrape.model.ListingKey;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.model.ScrapeCycleResult;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans one saved search out to its sites. The adapter timeout covers a single guarded attempt and
 * starts once the site's concurrency slot is held, so time spent queued is never a failure.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final SiteAdapterRegistry adapters;
    private final SiteGuardRegistry guards;
    private final ScraperProperties properties;
    private final ExecutorService adapterExecutor;
    private final ScheduledThreadPoolExecutor timeoutTimer;

    public ScrapeOrchestratorService(
        SiteAdapterRegistry adapters,
        SiteGuardRegistry guards,
        ScraperProperties properties,
        @Qualifier("adapterExecutor") ExecutorService adapterExecutor
    ) {
        this.adapters = adapters;
        this.guards = guards;
        this.properties = properties;
        this.adapterExecutor = adapterExecutor;
        this.timeoutTimer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("adapter-timeout");
            thread.setDaemon(true);
            return thread;
        });
        this.timeoutTimer.setRemoveOnCancelPolicy(true);
    }

    public ScrapeCycleResult scrape(SavedSearch search, CancellationToken cancellation) {
        SearchCriteria criteria = search.criteria();
        Map<MarketplaceSite, AdapterRun> runs = new EnumMap<>(MarketplaceSite.class);
        Map<MarketplaceSite, CompletableFuture<AdapterRun>> pending = new EnumMap<>(MarketplaceSite.class);

        for (MarketplaceSite site : criteria.sites()) {
            SiteAdapter adapter = adapters.adapterFor(site);
            if (adapter == null || !guards.isEnabled(site)) {
                String reason = adapter == null ? "no adapter registered" : "site disabled";
                log.info("Search {}: skipping {} ({})", search.id(), site.key(), reason);
                runs.put(site, AdapterRun.failed(site, AdapterErrorKind.UNSUPPORTED, 0, reason));
                continue;
            }
            try {
                pending.put(site, CompletableFuture.supplyAsync(
                    () -> runWithRetries(search.id(), adapter, criteria, cancellation),
                    adapterExecutor
                ));
            } catch (RejectedExecutionException e) {
                runs.put(site, AdapterRun.failed(site, AdapterErrorKind.CANCELLED, 0, "adapter pool unavailable"));
            }
        }

        for (Map.Entry<MarketplaceSite, CompletableFuture<AdapterRun>> entry : pending.entrySet()) {
            MarketplaceSite site = entry.getKey();
            try {
                runs.put(site, entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.getValue().cancel(true);
                runs.put(site, AdapterRun.failed(site, AdapterErrorKind.CANCELLED, 0, "interrupted"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Search {}: {} adapter crashed", search.id(), site.key(), cause);
                runs.put(site, AdapterRun.failed(site, AdapterErrorKind.PARSE, 1, cause.getClass().getSimpleName()));
            }
        }

        Map<ListingKey, MarketplaceListing> merged = new LinkedHashMap<>();
        List<AdapterOutcome> outcomes = new ArrayList<>();
        for (MarketplaceSite site : criteria.sites()) {
            AdapterRun run = runs.get(site);
            outcomes.add(run.outcome());
            for (MarketplaceListing listing : run.listings()) {
                merged.putIfAbsent(listing.key(), listing);
            }
        }
        return new ScrapeCycleResult(search.id(), new ArrayList<>(merged.values()), outcomes);
    }

    private AdapterRun runWithRetries(
        long searchId,
        SiteAdapter adapter,
        SearchCriteria criteria,
        CancellationToken cancellation
    ) {
        MarketplaceSite site = adapter.site();
        SiteGuard guard = guards.guard(site);
        int maxAttempts = 1 + properties.getAdapterMaxRetries();
        for (int attempt = 1; ; attempt++) {
            try {
                List<MarketplaceListing> listings = guard.execute(
                    cancellation,
                    () -> fetchWithinTimeout(adapter, criteria, cancellation)
                );
                log.info("Search {}: {} returned {} listings (attempt {})", searchId, site.key(), listings.size(), attempt);
                return AdapterRun.success(site, listings, attempt);
            } catch (AdapterException e) {
                boolean retry = e.kind().retryable() && attempt < maxAttempts && !cancellation.isCancelled();
                logFailure(searchId, site, e, attempt, retry);
                if (!retry) {
                    return AdapterRun.failed(site, e.kind(), attempt, e.getMessage());
                }
                try {
                    cancellation.sleep(backoff(attempt), site);
                } catch (AdapterException cancelled) {
                    return AdapterRun.failed(site, AdapterErrorKind.CANCELLED, attempt, cancelled.getMessage());
                }
            } catch (RuntimeException e) {
                log.error("Search {}: {} adapter threw unexpectedly", searchId, site.key(), e);
                return AdapterRun.failed(site, AdapterErrorKind.PARSE, attempt, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    /**
     * Runs one adapter call under its own token. The timer is armed here, inside the guarded
     * call, and a fetch it interrupts surfaces as TIMEOUT unless the cycle itself was cancelled.
     */
    private List<MarketplaceListing> fetchWithinTimeout(
        SiteAdapter adapter,
        SearchCriteria criteria,
        CancellationToken cancellation
    ) throws AdapterException {
        int timeoutSeconds = properties.getAdapterTimeoutSeconds();
        CancellationToken attemptToken = new CancellationToken();
        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> timer = timeoutTimer.schedule(() -> {
            timedOut.set(true);
            attemptToken.cancel("adapter timeout");
        }, timeoutSeconds, TimeUnit.SECONDS);
        try (CancellationToken.Registration ignored = cancellation.onCancel(() -> attemptToken.cancel(cancellation.reason()))) {
            return adapter.fetch(criteria, properties.getPageLimit(), attemptToken);
        } catch (AdapterException e) {
            if (timedOut.get() && !cancellation.isCancelled()) {
                throw new AdapterException(
                    AdapterErrorKind.TIMEOUT,
                    adapter.site(),
                    "adapter exceeded " + timeoutSeconds + "s",
                    e
                );
            }
            throw e;
        } finally {
            timer.cancel(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        timeoutTimer.shutdownNow();
    }

    private void logFailure(long searchId, MarketplaceSite site, AdapterException e, int attempt, boolean retry) {
        switch (e.kind()) {
            case BLOCKED -> log.warn("Search {}: {} blocked: {}", searchId, site.key(), e.getMessage());
            case PARSE -> log.error("Search {}: {} parse failure: {}", searchId, site.key(), e.getMessage(), e);
            case CIRCUIT_OPEN -> log.info("Search {}: {} skipped, {}", searchId, site.key(), e.getMessage());
            case CANCELLED -> log.info("Search {}: {} cancelled", searchId, site.key());
            default -> log.warn(
                "Search {}: {} {} on attempt {}{}: {}",
                searchId,
                site.key(),
                e.kind(),
                attempt,
                retry ? " (retrying)" : "",
                e.getMessage()
            );
        }
    }

    Duration backoff(int attempt) {
        int baseDelayMs = properties.getAdapterRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return Duration.ZERO;
        }
        long delay = (long) baseDelayMs * (1L << Math.max(0, Math.min(attempt - 1, 16)));
        int maxDelayMs = properties.getAdapterRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return Duration.ofMillis((delay / 2) + jitter);
    }

    private record AdapterRun(AdapterOutcome outcome, List<MarketplaceListing> listings) {
        static AdapterRun success(MarketplaceSite site, List<MarketplaceListing> listings, int attempts) {
            List<MarketplaceListing> safe = listings == null ? List.of() : listings;
            return new AdapterRun(AdapterOutcome.success(site, safe.size(), attempts), safe);
        }

        static AdapterRun failed(MarketplaceSite site, AdapterErrorKind kind, int attempts, String message) {
            return new AdapterRun(AdapterOutcome.failed(site, kind, attempts, message), List.of());
        }
    }
}
