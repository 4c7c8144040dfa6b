package com.marketwatch.tracker.scrape.model;

import java.time.Instant;

public record CycleRunMeta(long cycleId, Instant startedAt, Instant finishedAt, String status) {
}
