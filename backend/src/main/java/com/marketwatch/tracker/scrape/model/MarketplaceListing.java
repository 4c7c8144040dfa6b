package com.marketwatch.tracker.scrape.model;

import java.time.Instant;

public record MarketplaceListing(
    MarketplaceSite site,
    String externalId,
    String title,
    long priceMinor,
    String currency,
    String url,
    String imageUrl,
    Instant fetchedAt
) {
    public ListingKey key() {
        return new ListingKey(site, externalId);
    }
}
