package com.marketwatch.tracker.scrape.notify;

public record DispatchReport(int events, int delivered, int failed) {
    public static DispatchReport empty() {
        return new DispatchReport(0, 0, 0);
    }
}
