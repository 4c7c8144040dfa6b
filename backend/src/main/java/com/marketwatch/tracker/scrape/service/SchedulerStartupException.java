package com.marketwatch.tracker.scrape.service;

public class SchedulerStartupException extends RuntimeException {
    public SchedulerStartupException(String message) {
        super(message);
    }
}
