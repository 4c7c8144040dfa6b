package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;
import com.marketwatch.tracker.scrape.adapter.AdapterException;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.adapter.SiteAdapter;
import com.marketwatch.tracker.scrape.adapter.SiteAdapterRegistry;
import com.marketwatch.tracker.scrape.guard.SiteGuardRegistry;
import com.marketwatch.tracker.scrape.model.AdapterOutcome;
import com.marketwatch.tracker.scrape.model.ListingKey;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.model.SavedSearchCycleOutcome;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import com.marketwatch.tracker.scrape.persistence.PersistenceGateway;
import com.marketwatch.tracker.scrape.persistence.SavedSearchNotFoundException;
import com.marketwatch.tracker.scrape.persistence.SnapshotConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.marketwatch.tracker.scrape.service.DeduplicationEngineTest.listing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SavedSearchCycleServiceTest {
    private static final Instant CYCLE_AT = Instant.parse("2026-03-01T09:00:00Z");

    private ExecutorService executor;
    private ScraperProperties properties;
    private PersistenceGateway gateway;
    private SiteAdapter siteA;
    private SiteAdapter siteB;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        properties = new ScraperProperties();
        properties.setAdapterMaxRetries(0);
        gateway = mock(PersistenceGateway.class);
        siteA = mock(SiteAdapter.class);
        when(siteA.site()).thenReturn(MarketplaceSite.YAHOO_AUCTIONS);
        siteB = mock(SiteAdapter.class);
        when(siteB.site()).thenReturn(MarketplaceSite.RAKUTEN);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void partialFailureCommitsNewListingsAndEmitsOneEvent() throws Exception {
        when(siteA.fetch(any(), anyInt(), any())).thenReturn(List.of(
            listing(MarketplaceSite.YAHOO_AUCTIONS, "1", 500),
            listing(MarketplaceSite.YAHOO_AUCTIONS, "2", 300)
        ));
        when(siteB.fetch(any(), anyInt(), any()))
            .thenThrow(AdapterException.blocked(MarketplaceSite.RAKUTEN, "captcha"));
        SavedSearch search = search(Set.of(new ListingKey(MarketplaceSite.YAHOO_AUCTIONS, "1")));

        SearchProcessingResult result = service().process(search, new CancellationToken(), CYCLE_AT);

        assertThat(result.outcome().status()).isEqualTo(SavedSearchCycleOutcome.Status.COMMITTED);
        assertThat(result.outcome().newListingCount()).isEqualTo(1);
        assertThat(result.outcome().adapterOutcomes()).extracting(AdapterOutcome::describe)
            .containsExactly("yahoo_auctions: success(2)", "rakuten: failed(BLOCKED)");
        assertThat(result.event()).isNotNull();
        assertThat(result.event().newListings()).singleElement()
            .satisfies(listing -> {
                assertThat(listing.externalId()).isEqualTo("2");
                assertThat(listing.priceMinor()).isEqualTo(300);
                assertThat(listing.site()).isEqualTo(MarketplaceSite.YAHOO_AUCTIONS);
            });

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Set<ListingKey>> known = ArgumentCaptor.forClass(Set.class);
        verify(gateway).updateSnapshot(eq(7L), eq(3L), known.capture(), eq(CYCLE_AT));
        assertThat(known.getValue()).containsExactlyInAnyOrder(
            new ListingKey(MarketplaceSite.YAHOO_AUCTIONS, "1"),
            new ListingKey(MarketplaceSite.YAHOO_AUCTIONS, "2")
        );
        verify(gateway).appendFeedEntries(eq(7L), any(), eq(CYCLE_AT));
    }

    @Test
    void allAdaptersFailingLeavesSnapshotUntouched() throws Exception {
        when(siteA.fetch(any(), anyInt(), any()))
            .thenThrow(AdapterException.parse(MarketplaceSite.YAHOO_AUCTIONS, "layout changed", null));
        when(siteB.fetch(any(), anyInt(), any()))
            .thenThrow(AdapterException.blocked(MarketplaceSite.RAKUTEN, "HTTP 429"));

        SearchProcessingResult result = service().process(search(Set.of()), new CancellationToken(), CYCLE_AT);

        assertThat(result.outcome().status()).isEqualTo(SavedSearchCycleOutcome.Status.ALL_ADAPTERS_FAILED);
        assertThat(result.outcome().adapterOutcomes()).extracting(AdapterOutcome::errorKind)
            .containsExactly(AdapterErrorKind.PARSE, AdapterErrorKind.BLOCKED);
        assertThat(result.event()).isNull();
        verify(gateway, never()).updateSnapshot(anyLong(), anyLong(), anySet(), any());
        verify(gateway, never()).appendFeedEntries(anyLong(), any(), any());
    }

    @Test
    void noEventWhenNothingNew() throws Exception {
        when(siteA.fetch(any(), anyInt(), any())).thenReturn(List.of(listing(MarketplaceSite.YAHOO_AUCTIONS, "1", 500)));
        when(siteB.fetch(any(), anyInt(), any())).thenReturn(List.of());

        SearchProcessingResult result = service().process(
            search(Set.of(new ListingKey(MarketplaceSite.YAHOO_AUCTIONS, "1"))),
            new CancellationToken(),
            CYCLE_AT
        );

        assertThat(result.outcome().committed()).isTrue();
        assertThat(result.event()).isNull();
        verify(gateway).updateSnapshot(eq(7L), eq(3L), anySet(), eq(CYCLE_AT));
    }

    @Test
    void deletedSearchIsDroppedWithoutError() throws Exception {
        when(siteA.fetch(any(), anyInt(), any())).thenReturn(List.of(listing(MarketplaceSite.YAHOO_AUCTIONS, "9", 900)));
        when(siteB.fetch(any(), anyInt(), any())).thenReturn(List.of());
        doThrow(new SavedSearchNotFoundException(7L))
            .when(gateway).updateSnapshot(anyLong(), anyLong(), anySet(), any());

        SearchProcessingResult result = service().process(search(Set.of()), new CancellationToken(), CYCLE_AT);

        assertThat(result.outcome().status()).isEqualTo(SavedSearchCycleOutcome.Status.NOT_FOUND);
        assertThat(result.event()).isNull();
        verify(gateway, never()).appendFeedEntries(anyLong(), any(), any());
    }

    @Test
    void concurrentSnapshotChangeIsReportedAsConflict() throws Exception {
        when(siteA.fetch(any(), anyInt(), any())).thenReturn(List.of(listing(MarketplaceSite.YAHOO_AUCTIONS, "9", 900)));
        when(siteB.fetch(any(), anyInt(), any())).thenReturn(List.of());
        doThrow(new SnapshotConflictException(7L, 3L))
            .when(gateway).updateSnapshot(anyLong(), anyLong(), anySet(), any());

        SearchProcessingResult result = service().process(search(Set.of()), new CancellationToken(), CYCLE_AT);

        assertThat(result.outcome().status()).isEqualTo(SavedSearchCycleOutcome.Status.CONFLICT);
        assertThat(result.event()).isNull();
    }

    @Test
    void cancelledBeforeStartDoesNothing() throws Exception {
        CancellationToken token = new CancellationToken();
        token.cancel("shutdown");

        SearchProcessingResult result = service().process(search(Set.of()), token, CYCLE_AT);

        assertThat(result.outcome().status()).isEqualTo(SavedSearchCycleOutcome.Status.CANCELLED);
        verify(siteA, never()).fetch(any(), anyInt(), any());
        verify(gateway, never()).updateSnapshot(anyLong(), anyLong(), anySet(), any());
    }

    @Test
    void emptyEventsAreEmittedWhenConfigured() throws Exception {
        properties.getNotifications().setEmitEmptyEvents(true);
        when(siteA.fetch(any(), anyInt(), any())).thenReturn(List.of());
        when(siteB.fetch(any(), anyInt(), any())).thenReturn(List.of());

        SearchProcessingResult result = service().process(search(Set.of()), new CancellationToken(), CYCLE_AT);

        assertThat(result.event()).isNotNull();
        assertThat(result.event().newItemCount()).isZero();
    }

    private SavedSearchCycleService service() {
        ScrapeOrchestratorService orchestrator = new ScrapeOrchestratorService(
            new SiteAdapterRegistry(List.of(siteA, siteB)),
            new SiteGuardRegistry(properties, Clock.systemUTC()),
            properties,
            executor
        );
        return new SavedSearchCycleService(
            orchestrator,
            new DeduplicationEngine(),
            new SnapshotCommitService(gateway),
            properties,
            Clock.fixed(CYCLE_AT, ZoneOffset.UTC)
        );
    }

    private static SavedSearch search(Set<ListingKey> known) {
        SearchCriteria criteria = new SearchCriteria(
            List.of("film", "camera"),
            null,
            null,
            EnumSet.of(MarketplaceSite.YAHOO_AUCTIONS, MarketplaceSite.RAKUTEN)
        );
        return new SavedSearch(7L, "Film cameras", criteria, true, known, null, 3L);
    }
}
