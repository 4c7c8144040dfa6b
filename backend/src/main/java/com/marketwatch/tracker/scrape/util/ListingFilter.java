package com.marketwatch.tracker.scrape.util;

import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.SearchCriteria;

import java.text.Normalizer;
import java.util.Locale;

public final class ListingFilter {
    private ListingFilter() {
    }

    public static boolean matches(SearchCriteria criteria, MarketplaceListing listing) {
        if (criteria == null || listing == null) {
            return false;
        }
        if (!criteria.acceptsPrice(listing.priceMinor())) {
            return false;
        }
        String title = fold(listing.title());
        for (String keyword : criteria.keywords()) {
            if (!title.contains(fold(keyword))) {
                return false;
            }
        }
        return true;
    }

    static String fold(String value) {
        if (value == null) {
            return "";
        }
        return Normalizer.normalize(value, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    }
}
