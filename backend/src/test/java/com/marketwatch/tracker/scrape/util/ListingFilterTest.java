package com.marketwatch.tracker.scrape.util;

import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListingFilterTest {

    private final SearchCriteria criteria =
        new SearchCriteria(List.of("leica", "M6"), 10000L, 200000L, Set.of(MarketplaceSite.RAKUTEN));

    @Test
    void requiresEveryKeywordIgnoringCaseAndWidth() {
        assertTrue(ListingFilter.matches(criteria, listing("ＬＥＩＣＡ Ｍ６ ボディ", 120000)));
        assertFalse(ListingFilter.matches(criteria, listing("Leica M3 body", 120000)));
    }

    @Test
    void rejectsPricesOutsideBounds() {
        assertFalse(ListingFilter.matches(criteria, listing("Leica M6", 9999)));
        assertFalse(ListingFilter.matches(criteria, listing("Leica M6", 200001)));
        assertTrue(ListingFilter.matches(criteria, listing("Leica M6", 200000)));
    }

    private static MarketplaceListing listing(String title, long price) {
        return new MarketplaceListing(
            MarketplaceSite.RAKUTEN,
            "item-1",
            title,
            price,
            "JPY",
            "https://item.rakuten.co.jp/shop/item-1/",
            null,
            Instant.parse("2026-01-01T00:00:00Z")
        );
    }
}
