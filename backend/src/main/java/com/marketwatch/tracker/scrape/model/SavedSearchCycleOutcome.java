package com.marketwatch.tracker.scrape.model;

import java.time.Instant;
import java.util.List;

public record SavedSearchCycleOutcome(
    long savedSearchId,
    String searchName,
    Status status,
    int newListingCount,
    List<AdapterOutcome> adapterOutcomes,
    Instant finishedAt
) {
    public enum Status {
        COMMITTED,
        ALL_ADAPTERS_FAILED,
        NOT_FOUND,
        CONFLICT,
        CANCELLED,
        FAILED
    }

    public SavedSearchCycleOutcome {
        adapterOutcomes = adapterOutcomes == null ? List.of() : List.copyOf(adapterOutcomes);
    }

    public boolean committed() {
        return status == Status.COMMITTED;
    }
}
