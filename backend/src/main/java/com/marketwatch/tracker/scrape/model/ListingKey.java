package com.marketwatch.tracker.scrape.model;

import java.util.Objects;

public record ListingKey(MarketplaceSite site, String externalId) {
    public ListingKey {
        Objects.requireNonNull(site, "site");
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must not be blank");
        }
    }
}
