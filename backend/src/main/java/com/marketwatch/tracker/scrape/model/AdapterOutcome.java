package com.marketwatch.tracker.scrape.model;

import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;

public record AdapterOutcome(
    MarketplaceSite site,
    Status status,
    int listingCount,
    AdapterErrorKind errorKind,
    int attempts,
    String message
) {
    public enum Status {
        SUCCESS,
        FAILED
    }

    public static AdapterOutcome success(MarketplaceSite site, int listingCount, int attempts) {
        return new AdapterOutcome(site, Status.SUCCESS, listingCount, null, attempts, null);
    }

    public static AdapterOutcome failed(MarketplaceSite site, AdapterErrorKind errorKind, int attempts, String message) {
        return new AdapterOutcome(site, Status.FAILED, 0, errorKind, attempts, message);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public String describe() {
        return succeeded()
            ? site.key() + ": success(" + listingCount + ")"
            : site.key() + ": failed(" + errorKind + ")";
    }
}
