package com.marketwatch.tracker.scrape.guard;

import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;
import com.marketwatch.tracker.scrape.adapter.AdapterException;
import com.marketwatch.tracker.scrape.model.CircuitState;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Consecutive-failure breaker for one site. Only NETWORK, BLOCKED and TIMEOUT failures count,
 * and only those inside the sliding failure window. HALF_OPEN admits a single trial call.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final MarketplaceSite site;
    private final int failureThreshold;
    private final Duration failureWindow;
    private final Duration cooldown;
    private final Clock clock;
    private final Deque<Instant> failures = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private Instant openUntil;
    private boolean trialInFlight;

    public CircuitBreaker(
        MarketplaceSite site,
        int failureThreshold,
        Duration failureWindow,
        Duration cooldown,
        Clock clock
    ) {
        this.site = site;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.failureWindow = failureWindow;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public synchronized void acquirePermission() throws AdapterException {
        Instant now = clock.instant();
        if (state == CircuitState.OPEN) {
            if (now.isBefore(openUntil)) {
                throw AdapterException.circuitOpen(site, "circuit open until " + openUntil);
            }
            state = CircuitState.HALF_OPEN;
            trialInFlight = false;
            log.info("Circuit for {} half-open; admitting one trial call", site.key());
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                throw AdapterException.circuitOpen(site, "trial call already in flight");
            }
            trialInFlight = true;
        }
    }

    public synchronized void recordSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("Circuit for {} closed after successful trial call", site.key());
        }
        failures.clear();
        state = CircuitState.CLOSED;
        openUntil = null;
        trialInFlight = false;
    }

    public synchronized void recordFailure(AdapterErrorKind kind) {
        if (kind == null || !kind.tripsBreaker()) {
            // Inconclusive trial call; the next caller may try again.
            trialInFlight = false;
            return;
        }
        Instant now = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            open(now);
            return;
        }
        failures.addLast(now);
        Instant windowStart = now.minus(failureWindow);
        while (!failures.isEmpty() && failures.peekFirst().isBefore(windowStart)) {
            failures.removeFirst();
        }
        if (failures.size() >= failureThreshold) {
            open(now);
        }
    }

    public synchronized CircuitState state() {
        if (state == CircuitState.OPEN && !clock.instant().isBefore(openUntil)) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    public synchronized int consecutiveFailures() {
        return failures.size();
    }

    public synchronized Instant openUntil() {
        return state == CircuitState.OPEN ? openUntil : null;
    }

    private void open(Instant now) {
        state = CircuitState.OPEN;
        openUntil = now.plus(cooldown);
        trialInFlight = false;
        log.warn("Circuit for {} opened after {} failures; cooling down until {}", site.key(), failures.size(), openUntil);
    }
}
