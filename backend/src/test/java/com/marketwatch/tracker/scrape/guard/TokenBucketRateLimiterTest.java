package com.marketwatch.tracker.scrape.guard;

import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;
import com.marketwatch.tracker.scrape.adapter.AdapterException;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketRateLimiterTest {

    @Test
    void burstIsAvailableImmediatelyThenCallersQueue() {
        AtomicLong nanos = new AtomicLong();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2.0, 2, nanos::get);

        assertThat(limiter.reserve()).isZero();
        assertThat(limiter.reserve()).isZero();
        assertThat(limiter.reserve()).isEqualTo(500);
        assertThat(limiter.reserve()).isEqualTo(1000);
    }

    @Test
    void refillsOverTimeUpToBurst() {
        AtomicLong nanos = new AtomicLong();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, 3, nanos::get);
        limiter.reserve();
        limiter.reserve();
        limiter.reserve();
        assertThat(limiter.availableTokens()).isZero();

        nanos.addAndGet(60_000_000_000L);

        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void cancelledWaitFailsFast() {
        AtomicLong nanos = new AtomicLong();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(0.01, 1, nanos::get);
        CancellationToken token = new CancellationToken();
        limiter.reserve();
        token.cancel("shutdown");

        assertThatThrownBy(() -> limiter.acquire(token, MarketplaceSite.RAKUTEN))
            .isInstanceOf(AdapterException.class)
            .extracting(e -> ((AdapterException) e).kind())
            .isEqualTo(AdapterErrorKind.CANCELLED);
    }
}
