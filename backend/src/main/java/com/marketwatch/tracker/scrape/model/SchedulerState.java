package com.marketwatch.tracker.scrape.model;

public enum SchedulerState {
    IDLE,
    RUNNING,
    CANCELLING
}
