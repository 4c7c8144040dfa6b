package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.scrape.model.NotificationEvent;
import com.marketwatch.tracker.scrape.model.SavedSearchCycleOutcome;

public record SearchProcessingResult(SavedSearchCycleOutcome outcome, NotificationEvent event) {
}
