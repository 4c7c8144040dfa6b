package com.marketwatch.tracker.scrape.model;

public record SavedSearchFilter(Boolean notificationsEnabled) {
    public static SavedSearchFilter all() {
        return new SavedSearchFilter(null);
    }

    public static SavedSearchFilter notificationsEnabledOnly() {
        return new SavedSearchFilter(true);
    }
}
