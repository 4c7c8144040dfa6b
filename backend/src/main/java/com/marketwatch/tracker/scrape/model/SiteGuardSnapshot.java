package com.marketwatch.tracker.scrape.model;

import java.time.Instant;

public record SiteGuardSnapshot(
    MarketplaceSite site,
    CircuitState circuitState,
    int consecutiveFailures,
    Instant openUntil,
    int availableSlots
) {
}
