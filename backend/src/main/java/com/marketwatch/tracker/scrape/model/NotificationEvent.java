package com.marketwatch.tracker.scrape.model;

import java.time.Instant;
import java.util.List;

public record NotificationEvent(
    long savedSearchId,
    String searchName,
    List<MarketplaceListing> newListings,
    Instant cycleTimestamp
) {
    public NotificationEvent {
        newListings = newListings == null ? List.of() : List.copyOf(newListings);
    }

    public int newItemCount() {
        return newListings.size();
    }
}
