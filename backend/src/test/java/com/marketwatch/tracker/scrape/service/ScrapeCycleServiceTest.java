package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.model.AdapterOutcome;
import com.marketwatch.tracker.scrape.model.CycleSummary;
import com.marketwatch.tracker.scrape.model.CycleTrigger;
import com.marketwatch.tracker.scrape.model.DedupResult;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.NotificationEvent;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.model.SavedSearchCycleOutcome;
import com.marketwatch.tracker.scrape.model.SavedSearchFilter;
import com.marketwatch.tracker.scrape.model.ScrapeCycleResult;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import com.marketwatch.tracker.scrape.notify.DispatchReport;
import com.marketwatch.tracker.scrape.notify.NotificationDispatcher;
import com.marketwatch.tracker.scrape.persistence.PersistenceGateway;
import com.marketwatch.tracker.scrape.persistence.ScrapeJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import static com.marketwatch.tracker.scrape.service.DeduplicationEngineTest.listing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScrapeCycleServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private PersistenceGateway gateway;

    @Mock
    private ScrapeJdbcRepository repository;

    @Mock
    private ScrapeOrchestratorService orchestrator;

    @Mock
    private NotificationDispatcher dispatcher;

    private ExecutorService searchExecutor;
    private ScraperProperties properties;

    @BeforeEach
    void setUp() {
        searchExecutor = Executors.newSingleThreadExecutor();
        properties = new ScraperProperties();
        when(repository.insertCycle(any(), any())).thenReturn(42L);
        when(dispatcher.dispatch(any())).thenAnswer(invocation -> {
            List<NotificationEvent> events = invocation.getArgument(0);
            return new DispatchReport(events.size(), events.size(), 0);
        });
    }

    @AfterEach
    void tearDown() {
        searchExecutor.shutdownNow();
    }

    @Test
    void cancellationAfterFirstCommitLeavesSecondSearchUntouched() {
        SavedSearch first = search(1L);
        SavedSearch second = search(2L);
        when(gateway.getSavedSearches(any())).thenReturn(List.of(first, second));
        when(orchestrator.scrape(any(), any())).thenAnswer(invocation -> scraped(invocation.getArgument(0)));

        CancellationToken token = new CancellationToken();
        SnapshotCommitService commitService = mock(SnapshotCommitService.class);
        doAnswer(invocation -> {
            token.cancel("operator");
            return null;
        }).when(commitService).commit(eq(first), any(DedupResult.class), any());

        CycleSummary summary = service(commitService).runCycle(CycleTrigger.MANUAL, token, cycleId -> { });

        assertThat(summary.status()).isEqualTo("CANCELLED");
        assertThat(summary.searchOutcomes()).extracting(SavedSearchCycleOutcome::status)
            .containsExactly(SavedSearchCycleOutcome.Status.COMMITTED, SavedSearchCycleOutcome.Status.CANCELLED);
        verify(commitService, never()).commit(eq(second), any(DedupResult.class), any());
        verify(repository).completeCycle(eq(42L), any(), eq("CANCELLED"), anyString(), eq(2), eq(1), eq(1), eq(1));
    }

    @Test
    void cycleWithFailedSearchCompletesWithErrorsAndNotifiesCommittedOnes() {
        SavedSearch ok = search(1L);
        SavedSearch broken = search(2L);
        when(gateway.getSavedSearches(any())).thenReturn(List.of(ok, broken));
        when(orchestrator.scrape(eq(ok), any())).thenReturn(scraped(ok));
        when(orchestrator.scrape(eq(broken), any())).thenThrow(new IllegalStateException("boom"));
        SnapshotCommitService commitService = mock(SnapshotCommitService.class);

        AtomicLong startedId = new AtomicLong();
        CycleSummary summary = service(commitService)
            .runCycle(CycleTrigger.SCHEDULED, new CancellationToken(), startedId::set);

        assertThat(startedId).hasValue(42L);
        assertThat(summary.status()).isEqualTo("COMPLETED_WITH_ERRORS");
        assertThat(summary.newListingCount()).isEqualTo(1);
        assertThat(summary.notificationsEmitted()).isEqualTo(1);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<NotificationEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(dispatcher).dispatch(events.capture());
        assertThat(events.getValue()).extracting(NotificationEvent::savedSearchId).containsExactly(1L);
        verify(repository, times(2)).insertCycleSearchResult(eq(42L), any());
        verify(repository, times(2)).updateCycleHeartbeat(eq(42L), any());
    }

    @Test
    void noActiveSearchesIsRecorded() {
        when(gateway.getSavedSearches(any())).thenReturn(List.of());

        CycleSummary summary = service(mock(SnapshotCommitService.class))
            .runCycle(CycleTrigger.STARTUP, new CancellationToken(), cycleId -> { });

        assertThat(summary.status()).isEqualTo("NO_SEARCHES");
        verify(repository).completeCycle(eq(42L), any(), eq("NO_SEARCHES"), anyString(), eq(0), eq(0), eq(0), eq(0));
        verify(dispatcher, never()).dispatch(any());
        verify(gateway).getSavedSearches(SavedSearchFilter.notificationsEnabledOnly());
    }

    @Test
    void feedEntriesPastRetentionArePurgedAfterCycle() {
        when(gateway.getSavedSearches(any())).thenReturn(List.of());
        when(repository.deleteFeedEntriesAddedBefore(any())).thenReturn(3);

        service(mock(SnapshotCommitService.class))
            .runCycle(CycleTrigger.SCHEDULED, new CancellationToken(), cycleId -> { });

        verify(repository).deleteFeedEntriesAddedBefore(NOW.minus(Duration.ofDays(30)));
    }

    @Test
    void zeroRetentionSkipsFeedPurge() {
        properties.setFeedRetentionDays(0);
        when(gateway.getSavedSearches(any())).thenReturn(List.of());

        service(mock(SnapshotCommitService.class))
            .runCycle(CycleTrigger.SCHEDULED, new CancellationToken(), cycleId -> { });

        verify(repository, never()).deleteFeedEntriesAddedBefore(any());
    }

    @Test
    void unreachableGatewayFailsCycleButClosesIt() {
        doThrow(new DataAccessResourceFailureException("down"))
            .when(gateway).getSavedSearches(any());

        CycleSummary summary = service(mock(SnapshotCommitService.class))
            .runCycle(CycleTrigger.SCHEDULED, new CancellationToken(), cycleId -> { });

        assertThat(summary.status()).isEqualTo("FAILED");
        verify(repository).completeCycle(eq(42L), any(), eq("FAILED"), anyString(), anyInt(), anyInt(), anyInt(), anyInt());
    }

    private ScrapeCycleService service(SnapshotCommitService commitService) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SavedSearchCycleService searchCycleService = new SavedSearchCycleService(
            orchestrator,
            new DeduplicationEngine(),
            commitService,
            properties,
            clock
        );
        return new ScrapeCycleService(gateway, repository, searchCycleService, dispatcher, searchExecutor, properties, clock);
    }

    private static ScrapeCycleResult scraped(SavedSearch search) {
        MarketplaceListing listing = listing(MarketplaceSite.MERCARI, "m" + search.id(), 1000);
        return new ScrapeCycleResult(
            search.id(),
            List.of(listing),
            List.of(AdapterOutcome.success(MarketplaceSite.MERCARI, 1, 1))
        );
    }

    private static SavedSearch search(long id) {
        SearchCriteria criteria = new SearchCriteria(List.of("lens"), null, null, EnumSet.of(MarketplaceSite.MERCARI));
        return new SavedSearch(id, "Search " + id, criteria, true, Set.of(), null, 0L);
    }
}
