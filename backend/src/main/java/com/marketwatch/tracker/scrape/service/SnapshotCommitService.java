package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.scrape.model.DedupResult;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.persistence.PersistenceGateway;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Service
public class SnapshotCommitService {
    private final PersistenceGateway gateway;

    public SnapshotCommitService(PersistenceGateway gateway) {
        this.gateway = gateway;
    }

    @Transactional
    public void commit(SavedSearch search, DedupResult dedup, Instant cycleTimestamp) {
        gateway.updateSnapshot(search.id(), search.snapshotVersion(), dedup.updatedKnownIds(), cycleTimestamp);
        gateway.appendFeedEntries(search.id(), dedup.newListings(), cycleTimestamp);
    }
}
