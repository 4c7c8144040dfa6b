package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.scrape.model.MarketplaceSite;

public class AdapterException extends Exception {
    private final AdapterErrorKind kind;
    private final MarketplaceSite site;

    public AdapterException(AdapterErrorKind kind, MarketplaceSite site, String message) {
        this(kind, site, message, null);
    }

    public AdapterException(AdapterErrorKind kind, MarketplaceSite site, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.site = site;
    }

    public static AdapterException network(MarketplaceSite site, String message) {
        return new AdapterException(AdapterErrorKind.NETWORK, site, message);
    }

    public static AdapterException timeout(MarketplaceSite site, String message) {
        return new AdapterException(AdapterErrorKind.TIMEOUT, site, message);
    }

    public static AdapterException blocked(MarketplaceSite site, String message) {
        return new AdapterException(AdapterErrorKind.BLOCKED, site, message);
    }

    public static AdapterException parse(MarketplaceSite site, String message, Throwable cause) {
        return new AdapterException(AdapterErrorKind.PARSE, site, message, cause);
    }

    public static AdapterException circuitOpen(MarketplaceSite site, String message) {
        return new AdapterException(AdapterErrorKind.CIRCUIT_OPEN, site, message);
    }

    public static AdapterException cancelled(MarketplaceSite site, String message) {
        return new AdapterException(AdapterErrorKind.CANCELLED, site, message);
    }

    public AdapterErrorKind kind() {
        return kind;
    }

    public MarketplaceSite site() {
        return site;
    }
}
