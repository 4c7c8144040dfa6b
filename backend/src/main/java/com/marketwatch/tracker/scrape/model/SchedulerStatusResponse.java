package com.marketwatch.tracker.scrape.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SchedulerStatusResponse(
    boolean started,
    SchedulerState state,
    Long currentCycleId,
    long skippedTriggers,
    Instant nextTriggerAt,
    CycleSummary lastCycle,
    Map<Long, SavedSearchCycleOutcome> lastOutcomeBySearch,
    List<SiteGuardSnapshot> siteGuards
) {
}
