package com.marketwatch.tracker.scrape.model;

import java.time.Instant;
import java.util.Set;

public record SavedSearch(
    long id,
    String name,
    SearchCriteria criteria,
    boolean notificationsEnabled,
    Set<ListingKey> knownListingIds,
    Instant lastCycleAt,
    long snapshotVersion
) {
    public SavedSearch {
        knownListingIds = knownListingIds == null ? Set.of() : Set.copyOf(knownListingIds);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "Search " + id : name;
    }
}
