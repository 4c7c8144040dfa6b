package com.marketwatch.tracker.scrape.model;

import java.util.List;

public record ScrapeCycleResult(
    long savedSearchId,
    List<MarketplaceListing> listings,
    List<AdapterOutcome> outcomes
) {
    public ScrapeCycleResult {
        listings = listings == null ? List.of() : List.copyOf(listings);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public boolean allFailed() {
        return outcomes.stream().noneMatch(AdapterOutcome::succeeded);
    }

    public int succeededCount() {
        return (int) outcomes.stream().filter(AdapterOutcome::succeeded).count();
    }
}
