package com.marketwatch.tracker.scrape.guard;

import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;
import com.marketwatch.tracker.scrape.adapter.AdapterException;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.CircuitState;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SiteGuardTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));

    @Test
    void openCircuitSkipsCallWithoutInvokingAdapter() throws Exception {
        SiteGuard guard = guard(1);
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> guard.execute(CancellationToken.none(), () -> {
                throw AdapterException.network(MarketplaceSite.YAHOO_AUCTIONS, "reset");
            })).isInstanceOf(AdapterException.class);
        }
        assertThat(guard.snapshot().circuitState()).isEqualTo(CircuitState.OPEN);

        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> guard.execute(CancellationToken.none(), () -> calls.incrementAndGet()))
            .isInstanceOf(AdapterException.class)
            .extracting(e -> ((AdapterException) e).kind())
            .isEqualTo(AdapterErrorKind.CIRCUIT_OPEN);
        assertThat(calls).hasValue(0);
    }

    @Test
    void slotIsReleasedAfterEachCall() throws Exception {
        SiteGuard guard = guard(1);
        assertThat(guard.execute(CancellationToken.none(), () -> "first")).isEqualTo("first");
        assertThat(guard.execute(CancellationToken.none(), () -> "second")).isEqualTo("second");
        assertThat(guard.snapshot().availableSlots()).isEqualTo(1);
    }

    @Test
    void unexpectedRuntimeFailureDoesNotTripCircuit() {
        SiteGuard guard = guard(1);
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> guard.execute(CancellationToken.none(), () -> {
                throw new IllegalStateException("bad markup");
            })).isInstanceOf(IllegalStateException.class);
        }
        assertThat(guard.snapshot().circuitState()).isEqualTo(CircuitState.CLOSED);
        assertThat(guard.snapshot().availableSlots()).isEqualTo(1);
    }

    private SiteGuard guard(int maxConcurrent) {
        CircuitBreaker breaker = new CircuitBreaker(
            MarketplaceSite.YAHOO_AUCTIONS,
            2,
            Duration.ofMinutes(10),
            Duration.ofMinutes(5),
            clock
        );
        return new SiteGuard(
            MarketplaceSite.YAHOO_AUCTIONS,
            new TokenBucketRateLimiter(100.0, 10),
            breaker,
            maxConcurrent
        );
    }
}
