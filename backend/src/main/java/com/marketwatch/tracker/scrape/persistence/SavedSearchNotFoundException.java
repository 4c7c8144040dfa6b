package com.marketwatch.tracker.scrape.persistence;

public class SavedSearchNotFoundException extends RuntimeException {
    private final long savedSearchId;

    public SavedSearchNotFoundException(long savedSearchId) {
        super("Saved search " + savedSearchId + " no longer exists");
        this.savedSearchId = savedSearchId;
    }

    public long savedSearchId() {
        return savedSearchId;
    }
}
