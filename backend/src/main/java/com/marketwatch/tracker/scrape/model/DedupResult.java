package com.marketwatch.tracker.scrape.model;

import java.util.List;
import java.util.Set;

public record DedupResult(List<MarketplaceListing> newListings, Set<ListingKey> updatedKnownIds) {
    public DedupResult {
        newListings = List.copyOf(newListings);
        updatedKnownIds = Set.copyOf(updatedKnownIds);
    }
}
