package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.CycleSummary;
import com.marketwatch.tracker.scrape.model.CycleTrigger;
import com.marketwatch.tracker.scrape.model.NotificationEvent;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.model.SavedSearchCycleOutcome;
import com.marketwatch.tracker.scrape.model.SavedSearchFilter;
import com.marketwatch.tracker.scrape.notify.DispatchReport;
import com.marketwatch.tracker.scrape.notify.NotificationDispatcher;
import com.marketwatch.tracker.scrape.persistence.PersistenceGateway;
import com.marketwatch.tracker.scrape.persistence.ScrapeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongConsumer;

@Service
public class ScrapeCycleService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCycleService.class);

    private final PersistenceGateway gateway;
    private final ScrapeJdbcRepository repository;
    private final SavedSearchCycleService searchCycleService;
    private final NotificationDispatcher dispatcher;
    private final ExecutorService searchExecutor;
    private final ScraperProperties properties;
    private final Clock clock;

    public ScrapeCycleService(
        PersistenceGateway gateway,
        ScrapeJdbcRepository repository,
        SavedSearchCycleService searchCycleService,
        NotificationDispatcher dispatcher,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        ScraperProperties properties,
        Clock clock
    ) {
        this.gateway = gateway;
        this.repository = repository;
        this.searchCycleService = searchCycleService;
        this.dispatcher = dispatcher;
        this.searchExecutor = searchExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public CycleSummary runCycle(CycleTrigger trigger, CancellationToken cancellation, LongConsumer onCycleStarted) {
        Instant startedAt = clock.instant();
        long cycleId = repository.insertCycle(trigger, startedAt);
        onCycleStarted.accept(cycleId);
        log.info("Scrape cycle {} started ({})", cycleId, trigger);

        String status = "FAILED";
        String notes = null;
        List<SavedSearchCycleOutcome> outcomes = new ArrayList<>();
        DispatchReport dispatch = DispatchReport.empty();
        Instant finishedAt = null;
        try {
            List<SavedSearch> searches = gateway.getSavedSearches(SavedSearchFilter.notificationsEnabledOnly());
            if (searches.isEmpty()) {
                status = "NO_SEARCHES";
                notes = "No active saved searches";
            } else {
                List<CompletableFuture<SearchProcessingResult>> futures = new ArrayList<>();
                for (SavedSearch search : searches) {
                    futures.add(submit(search, cancellation, startedAt));
                }
                List<NotificationEvent> events = new ArrayList<>();
                for (CompletableFuture<SearchProcessingResult> future : futures) {
                    SearchProcessingResult result = future.join();
                    outcomes.add(result.outcome());
                    if (result.event() != null) {
                        events.add(result.event());
                    }
                    recordSearchResult(cycleId, result.outcome());
                }
                dispatch = dispatcher.dispatch(events);

                boolean allCommitted = outcomes.stream().allMatch(SavedSearchCycleOutcome::committed);
                if (cancellation.isCancelled()) {
                    status = "CANCELLED";
                    notes = cancellation.reason();
                } else {
                    status = allCommitted ? "COMPLETED" : "COMPLETED_WITH_ERRORS";
                    notes = "searches=" + outcomes.size();
                }
            }
        } catch (RuntimeException e) {
            log.warn("Scrape cycle {} failed", cycleId, e);
            status = "FAILED";
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            finishedAt = clock.instant();
            int committed = (int) outcomes.stream().filter(SavedSearchCycleOutcome::committed).count();
            int newListings = outcomes.stream().mapToInt(SavedSearchCycleOutcome::newListingCount).sum();
            repository.completeCycle(
                cycleId,
                finishedAt,
                status,
                notes,
                outcomes.size(),
                committed,
                outcomes.size() - committed,
                newListings
            );
        }
        purgeExpiredFeedEntries(startedAt);
        CycleSummary summary = new CycleSummary(
            cycleId,
            trigger,
            startedAt,
            finishedAt,
            status,
            outcomes,
            dispatch.events(),
            dispatch.failed()
        );
        log.info(
            "Scrape cycle {} finished: status={} searches={} new={} notifications={}",
            cycleId,
            status,
            outcomes.size(),
            summary.newListingCount(),
            dispatch.events()
        );
        return summary;
    }

    private void purgeExpiredFeedEntries(Instant cycleStartedAt) {
        int retentionDays = properties.getFeedRetentionDays();
        if (retentionDays <= 0) {
            return;
        }
        Instant cutoff = cycleStartedAt.minus(Duration.ofDays(retentionDays));
        try {
            int purged = repository.deleteFeedEntriesAddedBefore(cutoff);
            if (purged > 0) {
                log.info("Purged {} feed entries added before {}", purged, cutoff);
            }
        } catch (RuntimeException e) {
            log.warn("Feed purge before {} failed", cutoff, e);
        }
    }

    private CompletableFuture<SearchProcessingResult> submit(
        SavedSearch search,
        CancellationToken cancellation,
        Instant cycleTimestamp
    ) {
        try {
            return CompletableFuture.supplyAsync(
                () -> processSafely(search, cancellation, cycleTimestamp),
                searchExecutor
            );
        } catch (RejectedExecutionException e) {
            log.warn("Search {} not started: search pool unavailable", search.id());
            return CompletableFuture.completedFuture(failed(search, SavedSearchCycleOutcome.Status.CANCELLED));
        }
    }

    private SearchProcessingResult processSafely(SavedSearch search, CancellationToken cancellation, Instant cycleTimestamp) {
        try {
            return searchCycleService.process(search, cancellation, cycleTimestamp);
        } catch (RuntimeException e) {
            log.warn("Search {} failed unexpectedly", search.id(), e);
            return failed(search, SavedSearchCycleOutcome.Status.FAILED);
        }
    }

    private SearchProcessingResult failed(SavedSearch search, SavedSearchCycleOutcome.Status status) {
        return new SearchProcessingResult(
            new SavedSearchCycleOutcome(search.id(), search.displayName(), status, 0, List.of(), clock.instant()),
            null
        );
    }

    private void recordSearchResult(long cycleId, SavedSearchCycleOutcome outcome) {
        try {
            repository.insertCycleSearchResult(cycleId, outcome);
            repository.updateCycleHeartbeat(cycleId, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to record outcome of search {} in cycle {}", outcome.savedSearchId(), cycleId, e);
        }
    }
}
