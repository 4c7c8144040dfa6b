package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.scrape.model.DedupResult;
import com.marketwatch.tracker.scrape.model.ListingKey;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class DeduplicationEngine {
    static final Comparator<MarketplaceListing> LISTING_ORDER = Comparator
        .comparingLong(MarketplaceListing::priceMinor)
        .thenComparing(listing -> listing.site().key())
        .thenComparing(MarketplaceListing::externalId);

    /**
     * Splits merged listings into those never seen before and the grown known-id set.
     * Identity only: a known listing whose price or title changed is not new.
     */
    public DedupResult deduplicate(Set<ListingKey> knownIds, Collection<MarketplaceListing> merged) {
        Set<ListingKey> known = knownIds == null ? Set.of() : knownIds;
        Set<ListingKey> updated = new HashSet<>(known);
        Map<ListingKey, MarketplaceListing> fresh = new LinkedHashMap<>();
        if (merged != null) {
            for (MarketplaceListing listing : merged) {
                ListingKey key = listing.key();
                updated.add(key);
                if (!known.contains(key)) {
                    fresh.putIfAbsent(key, listing);
                }
            }
        }
        List<MarketplaceListing> newListings = new ArrayList<>(fresh.values());
        newListings.sort(LISTING_ORDER);
        return new DedupResult(newListings, updated);
    }
}
