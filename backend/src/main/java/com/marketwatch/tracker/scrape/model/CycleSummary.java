package com.marketwatch.tracker.scrape.model;

import java.time.Instant;
import java.util.List;

public record CycleSummary(
    long cycleId,
    CycleTrigger trigger,
    Instant startedAt,
    Instant finishedAt,
    String status,
    List<SavedSearchCycleOutcome> searchOutcomes,
    int notificationsEmitted,
    int deliveryFailures
) {
    public CycleSummary {
        searchOutcomes = searchOutcomes == null ? List.of() : List.copyOf(searchOutcomes);
    }

    public int newListingCount() {
        return searchOutcomes.stream().mapToInt(SavedSearchCycleOutcome::newListingCount).sum();
    }
}
