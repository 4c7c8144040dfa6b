package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.scrape.model.FeedEntryView;
import com.marketwatch.tracker.scrape.persistence.ScrapeJdbcRepository;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class FeedService {
    private final ScrapeJdbcRepository repository;

    public FeedService(ScrapeJdbcRepository repository) {
        this.repository = repository;
    }

    public List<FeedEntryView> getFeed(Long savedSearchId, boolean unreadOnly, Integer limit) {
        int safeLimit = limit == null ? 50 : Math.max(1, Math.min(limit, 500));
        return repository.findFeedEntries(savedSearchId, unreadOnly, safeLimit);
    }

    public void markRead(long feedEntryId) {
        if (!repository.markFeedEntryRead(feedEntryId)) {
            throw new ResponseStatusException(NOT_FOUND, "Feed entry not found: " + feedEntryId);
        }
    }
}
