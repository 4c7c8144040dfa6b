package com.marketwatch.tracker.scrape.guard;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SiteGuardSnapshot;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class SiteGuardRegistry {
    private final ScraperProperties properties;
    private final Clock clock;
    private final Map<MarketplaceSite, SiteGuard> guards = new ConcurrentHashMap<>();

    public SiteGuardRegistry(ScraperProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public SiteGuard guard(MarketplaceSite site) {
        return guards.computeIfAbsent(site, this::create);
    }

    public boolean isEnabled(MarketplaceSite site) {
        return properties.siteFor(site.key(), site.browserDriven()).isEnabled();
    }

    public List<SiteGuardSnapshot> snapshots() {
        List<SiteGuardSnapshot> snapshots = new ArrayList<>();
        for (MarketplaceSite site : MarketplaceSite.values()) {
            SiteGuard guard = guards.get(site);
            if (guard != null) {
                snapshots.add(guard.snapshot());
            }
        }
        return snapshots;
    }

    private SiteGuard create(MarketplaceSite site) {
        ScraperProperties.Site config = properties.siteFor(site.key(), site.browserDriven());
        CircuitBreaker breaker = new CircuitBreaker(
            site,
            config.getFailureThreshold(),
            Duration.ofMinutes(config.getFailureWindowMinutes()),
            Duration.ofMinutes(config.getCooldownMinutes()),
            clock
        );
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(config.getRequestsPerSecond(), config.getBurst());
        return new SiteGuard(site, limiter, breaker, config.getMaxConcurrent());
    }
}
