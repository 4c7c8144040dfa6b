package com.marketwatch.tracker.scrape.model;

import java.time.Instant;

public record FeedEntryView(
    long id,
    long savedSearchId,
    String searchName,
    MarketplaceSite site,
    String externalId,
    String title,
    long priceMinor,
    String currency,
    String url,
    String imageUrl,
    Instant addedAt,
    boolean read
) {
}
