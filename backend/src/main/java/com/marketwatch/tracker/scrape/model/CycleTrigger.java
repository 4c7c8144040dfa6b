package com.marketwatch.tracker.scrape.model;

public enum CycleTrigger {
    STARTUP,
    SCHEDULED,
    MANUAL
}
