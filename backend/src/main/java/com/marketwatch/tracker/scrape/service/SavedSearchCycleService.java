package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.AdapterOutcome;
import com.marketwatch.tracker.scrape.model.DedupResult;
import com.marketwatch.tracker.scrape.model.NotificationEvent;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.model.SavedSearchCycleOutcome;
import com.marketwatch.tracker.scrape.model.ScrapeCycleResult;
import com.marketwatch.tracker.scrape.persistence.SavedSearchNotFoundException;
import com.marketwatch.tracker.scrape.persistence.SnapshotConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scrape, dedup and commit for one saved search. Nothing is written unless at least one
 * adapter succeeded and the cycle is still live at commit time.
 */
@Service
public class SavedSearchCycleService {
    private static final Logger log = LoggerFactory.getLogger(SavedSearchCycleService.class);

    private final ScrapeOrchestratorService orchestrator;
    private final DeduplicationEngine deduplicationEngine;
    private final SnapshotCommitService commitService;
    private final ScraperProperties properties;
    private final Clock clock;

    public SavedSearchCycleService(
        ScrapeOrchestratorService orchestrator,
        DeduplicationEngine deduplicationEngine,
        SnapshotCommitService commitService,
        ScraperProperties properties,
        Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.deduplicationEngine = deduplicationEngine;
        this.commitService = commitService;
        this.properties = properties;
        this.clock = clock;
    }

    public SearchProcessingResult process(SavedSearch search, CancellationToken cancellation, Instant cycleTimestamp) {
        if (cancellation.isCancelled()) {
            return result(search, SavedSearchCycleOutcome.Status.CANCELLED, 0, List.of());
        }
        ScrapeCycleResult scraped = orchestrator.scrape(search, cancellation);
        List<AdapterOutcome> outcomes = scraped.outcomes();
        log.info(
            "Search {} ({}): {}",
            search.id(),
            search.displayName(),
            outcomes.stream().map(AdapterOutcome::describe).collect(Collectors.joining(", "))
        );

        if (cancellation.isCancelled()) {
            log.info("Search {} not committed: cycle cancelled", search.id());
            return result(search, SavedSearchCycleOutcome.Status.CANCELLED, 0, outcomes);
        }
        if (scraped.allFailed()) {
            log.warn("Search {}: every adapter failed; snapshot left unchanged", search.id());
            return result(search, SavedSearchCycleOutcome.Status.ALL_ADAPTERS_FAILED, 0, outcomes);
        }

        DedupResult dedup = deduplicationEngine.deduplicate(search.knownListingIds(), scraped.listings());
        if (cancellation.isCancelled()) {
            return result(search, SavedSearchCycleOutcome.Status.CANCELLED, 0, outcomes);
        }
        try {
            commitService.commit(search, dedup, cycleTimestamp);
        } catch (SavedSearchNotFoundException e) {
            log.info("Search {} was deleted during the cycle; dropping results", search.id());
            return result(search, SavedSearchCycleOutcome.Status.NOT_FOUND, 0, outcomes);
        } catch (SnapshotConflictException e) {
            log.warn("Search {} snapshot changed concurrently; dropping results: {}", search.id(), e.getMessage());
            return result(search, SavedSearchCycleOutcome.Status.CONFLICT, 0, outcomes);
        }

        int newCount = dedup.newListings().size();
        log.info("Search {} committed: {} new of {} merged listings", search.id(), newCount, scraped.listings().size());
        SavedSearchCycleOutcome outcome = outcome(search, SavedSearchCycleOutcome.Status.COMMITTED, newCount, outcomes);
        NotificationEvent event = null;
        if (search.notificationsEnabled() && (newCount > 0 || properties.getNotifications().isEmitEmptyEvents())) {
            event = new NotificationEvent(search.id(), search.displayName(), dedup.newListings(), cycleTimestamp);
        }
        return new SearchProcessingResult(outcome, event);
    }

    private SearchProcessingResult result(
        SavedSearch search,
        SavedSearchCycleOutcome.Status status,
        int newCount,
        List<AdapterOutcome> outcomes
    ) {
        return new SearchProcessingResult(outcome(search, status, newCount, outcomes), null);
    }

    private SavedSearchCycleOutcome outcome(
        SavedSearch search,
        SavedSearchCycleOutcome.Status status,
        int newCount,
        List<AdapterOutcome> outcomes
    ) {
        return new SavedSearchCycleOutcome(search.id(), search.displayName(), status, newCount, outcomes, clock.instant());
    }
}
