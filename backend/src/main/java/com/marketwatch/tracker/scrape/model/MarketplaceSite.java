package com.marketwatch.tracker.scrape.model;

import java.util.Locale;

public enum MarketplaceSite {
    YAHOO_AUCTIONS("yahoo_auctions", "Yahoo Auctions", "https://auctions.yahoo.co.jp", false),
    RAKUTEN("rakuten", "Rakuten", "https://search.rakuten.co.jp", false),
    MERCARI("mercari", "Mercari", "https://jp.mercari.com", true);

    private final String key;
    private final String displayName;
    private final String baseUrl;
    private final boolean browserDriven;

    MarketplaceSite(String key, String displayName, String baseUrl, boolean browserDriven) {
        this.key = key;
        this.displayName = displayName;
        this.baseUrl = baseUrl;
        this.browserDriven = browserDriven;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public boolean browserDriven() {
        return browserDriven;
    }

    public static MarketplaceSite fromKey(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (MarketplaceSite site : values()) {
            if (site.key.equals(normalized) || site.name().equalsIgnoreCase(normalized)) {
                return site;
            }
        }
        return null;
    }
}
