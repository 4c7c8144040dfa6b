package com.marketwatch.tracker.scrape.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record SearchCriteria(
    List<String> keywords,
    Long minPriceMinor,
    Long maxPriceMinor,
    Set<MarketplaceSite> sites
) {
    public SearchCriteria {
        List<String> cleaned = new ArrayList<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    cleaned.add(keyword.trim());
                }
            }
        }
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("at least one keyword is required");
        }
        if (minPriceMinor != null && minPriceMinor < 0) {
            throw new IllegalArgumentException("minPriceMinor must not be negative");
        }
        if (maxPriceMinor != null && maxPriceMinor < 0) {
            throw new IllegalArgumentException("maxPriceMinor must not be negative");
        }
        if (minPriceMinor != null && maxPriceMinor != null && minPriceMinor > maxPriceMinor) {
            throw new IllegalArgumentException("minPriceMinor must be <= maxPriceMinor");
        }
        if (sites == null || sites.isEmpty()) {
            throw new IllegalArgumentException("at least one site is required");
        }
        keywords = List.copyOf(cleaned);
        sites = Collections.unmodifiableSet(EnumSet.copyOf(sites));
    }

    public String joinedKeywords(String separator) {
        return String.join(separator, keywords);
    }

    public boolean acceptsPrice(long priceMinor) {
        if (minPriceMinor != null && priceMinor < minPriceMinor) {
            return false;
        }
        return maxPriceMinor == null || priceMinor <= maxPriceMinor;
    }
}
