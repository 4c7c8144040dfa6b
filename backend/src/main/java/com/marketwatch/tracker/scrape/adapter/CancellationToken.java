package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cycle-scoped cancellation signal threaded through every adapter call and wait.
 * Callbacks registered with {@link #onCancel(Runnable)} run once, on the cancelling thread.
 */
public final class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean cancel(String cancelReason) {
        synchronized (this) {
            if (isCancelled()) {
                return false;
            }
            reason = cancelReason == null ? "cancelled" : cancelReason;
            cancelled.countDown();
        }
        for (Runnable callback : callbacks) {
            runQuietly(callback);
        }
        callbacks.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled(MarketplaceSite site) throws AdapterException {
        if (isCancelled()) {
            throw AdapterException.cancelled(site, "cycle cancelled: " + reason);
        }
    }

    /**
     * Sleeps for the given duration unless cancelled first.
     */
    public void sleep(Duration duration, MarketplaceSite site) throws AdapterException {
        try {
            if (await(duration)) {
                throw AdapterException.cancelled(site, "cycle cancelled: " + reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AdapterException.cancelled(site, "interrupted");
        }
    }

    /**
     * Waits up to the given duration. Returns true when cancelled before it elapsed.
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!isCancelled()) {
                callbacks.add(callback);
                return () -> callbacks.remove(callback);
            }
        }
        runQuietly(callback);
        return () -> {
        };
    }

    private void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage());
        }
    }

    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
