package com.marketwatch.tracker.scrape.guard;

import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;
import com.marketwatch.tracker.scrape.adapter.AdapterException;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SiteGuardSnapshot;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

public class SiteGuard {
    private static final long SLOT_POLL_MILLIS = 200;

    private final MarketplaceSite site;
    private final TokenBucketRateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Semaphore slots;

    public SiteGuard(
        MarketplaceSite site,
        TokenBucketRateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        int maxConcurrent
    ) {
        this.site = site;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.slots = new Semaphore(Math.max(1, maxConcurrent), true);
    }

    public <T> T execute(CancellationToken cancellation, GuardedCall<T> call) throws AdapterException {
        circuitBreaker.acquirePermission();
        try {
            acquireSlot(cancellation);
        } catch (AdapterException e) {
            circuitBreaker.recordFailure(e.kind());
            throw e;
        }
        try {
            T result = call.call();
            circuitBreaker.recordSuccess();
            return result;
        } catch (AdapterException e) {
            circuitBreaker.recordFailure(e.kind());
            throw e;
        } catch (RuntimeException e) {
            circuitBreaker.recordFailure(AdapterErrorKind.PARSE);
            throw e;
        } finally {
            slots.release();
        }
    }

    /** Called by adapters before every outbound request. */
    public void awaitRequestPermit(CancellationToken cancellation) throws AdapterException {
        rateLimiter.acquire(cancellation, site);
    }

    public MarketplaceSite site() {
        return site;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public SiteGuardSnapshot snapshot() {
        return new SiteGuardSnapshot(
            site,
            circuitBreaker.state(),
            circuitBreaker.consecutiveFailures(),
            circuitBreaker.openUntil(),
            slots.availablePermits()
        );
    }

    private void acquireSlot(CancellationToken cancellation) throws AdapterException {
        try {
            while (!slots.tryAcquire(SLOT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                cancellation.throwIfCancelled(site);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AdapterException.cancelled(site, "interrupted waiting for slot");
        }
        if (cancellation.isCancelled()) {
            slots.release();
            cancellation.throwIfCancelled(site);
        }
    }

    @FunctionalInterface
    public interface GuardedCall<T> {
        T call() throws AdapterException;
    }
}
