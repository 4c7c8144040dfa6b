package com.marketwatch.tracker.scrape.adapter;

public enum AdapterErrorKind {
    NETWORK(true, true),
    TIMEOUT(true, true),
    BLOCKED(false, true),
    PARSE(false, false),
    CIRCUIT_OPEN(false, false),
    CANCELLED(false, false),
    UNSUPPORTED(false, false);

    private final boolean retryable;
    private final boolean tripsBreaker;

    AdapterErrorKind(boolean retryable, boolean tripsBreaker) {
        this.retryable = retryable;
        this.tripsBreaker = tripsBreaker;
    }

    public boolean retryable() {
        return retryable;
    }

    public boolean tripsBreaker() {
        return tripsBreaker;
    }
}
