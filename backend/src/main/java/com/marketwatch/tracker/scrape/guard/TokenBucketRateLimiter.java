package com.marketwatch.tracker.scrape.guard;

import com.marketwatch.tracker.scrape.adapter.AdapterException;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;

import java.time.Duration;
import java.util.function.LongSupplier;

public class TokenBucketRateLimiter {
    private final double permitsPerSecond;
    private final double burst;
    private final LongSupplier nanoTime;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double permitsPerSecond, int burst) {
        this(permitsPerSecond, burst, System::nanoTime);
    }

    TokenBucketRateLimiter(double permitsPerSecond, int burst, LongSupplier nanoTime) {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be positive");
        }
        this.permitsPerSecond = permitsPerSecond;
        this.burst = Math.max(1, burst);
        this.nanoTime = nanoTime;
        this.tokens = this.burst;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    /**
     * Takes one permit, waiting on the cancellation token until it is available.
     */
    public void acquire(CancellationToken cancellation, MarketplaceSite site) throws AdapterException {
        long waitMillis = reserve();
        if (waitMillis > 0) {
            cancellation.sleep(Duration.ofMillis(waitMillis), site);
        } else {
            cancellation.throwIfCancelled(site);
        }
    }

    /** Reserves a permit and returns how long the caller must wait before using it. */
    synchronized long reserve() {
        refill();
        tokens -= 1;
        if (tokens >= 0) {
            return 0;
        }
        return (long) Math.ceil((-tokens / permitsPerSecond) * 1000d);
    }

    public synchronized double availableTokens() {
        refill();
        return Math.max(0, tokens);
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(burst, tokens + (elapsed / 1_000_000_000d) * permitsPerSecond);
        lastRefillNanos = now;
    }
}
