package com.marketwatch.tracker.scrape.persistence;

import com.marketwatch.tracker.scrape.model.ListingKey;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.model.SavedSearchFilter;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Narrow store contract used by the scrape cycle. Saved searches are created and deleted elsewhere.
 */
public interface PersistenceGateway {
    List<SavedSearch> getSavedSearches(SavedSearchFilter filter);

    /**
     * Replaces the known-listing snapshot and stamps {@code lastCycleAt}, provided the stored
     * snapshot is still at {@code expectedVersion}.
     *
     * @throws SavedSearchNotFoundException when the search was deleted
     * @throws SnapshotConflictException when the snapshot version moved
     */
    void updateSnapshot(long savedSearchId, long expectedVersion, Set<ListingKey> newKnownIds, Instant lastCycleAt);

    void appendFeedEntries(long savedSearchId, List<MarketplaceListing> listings, Instant addedAt);

    boolean isReachable();
}
