package com.marketwatch.tracker.scrape.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
