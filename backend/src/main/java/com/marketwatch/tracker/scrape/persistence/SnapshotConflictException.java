package com.marketwatch.tracker.scrape.persistence;

public class SnapshotConflictException extends RuntimeException {
    private final long savedSearchId;
    private final long expectedVersion;

    public SnapshotConflictException(long savedSearchId, long expectedVersion) {
        super("Snapshot of saved search " + savedSearchId + " changed since version " + expectedVersion);
        this.savedSearchId = savedSearchId;
        this.expectedVersion = expectedVersion;
    }

    public long savedSearchId() {
        return savedSearchId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }
}
