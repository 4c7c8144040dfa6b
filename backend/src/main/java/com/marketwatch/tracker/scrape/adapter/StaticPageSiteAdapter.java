package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.scrape.guard.SiteGuard;
import com.marketwatch.tracker.scrape.guard.SiteGuardRegistry;
import com.marketwatch.tracker.scrape.http.PoliteHttpClient;
import com.marketwatch.tracker.scrape.model.HttpFetchResult;
import com.marketwatch.tracker.scrape.model.ListingKey;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import com.marketwatch.tracker.scrape.util.FetchFailureClassifier;
import com.marketwatch.tracker.scrape.util.ListingFilter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain GET + Jsoup adapter. Subclasses supply the search URL for a page and the parser for
 * the returned document; paging, rate-limit permits and failure classification live here.
 */
public abstract class StaticPageSiteAdapter implements SiteAdapter {
    private static final Logger log = LoggerFactory.getLogger(StaticPageSiteAdapter.class);
    protected static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    protected final PoliteHttpClient httpClient;
    protected final SiteGuardRegistry guards;
    protected final Clock clock;

    protected StaticPageSiteAdapter(PoliteHttpClient httpClient, SiteGuardRegistry guards, Clock clock) {
        this.httpClient = httpClient;
        this.guards = guards;
        this.clock = clock;
    }

    @Override
    public List<MarketplaceListing> fetch(SearchCriteria criteria, int pageLimit, CancellationToken cancellation)
        throws AdapterException {
        SiteGuard guard = guards.guard(site());
        Map<ListingKey, MarketplaceListing> collected = new LinkedHashMap<>();
        int maxPages = Math.max(1, pageLimit);
        for (int page = 1; page <= maxPages; page++) {
            cancellation.throwIfCancelled(site());
            guard.awaitRequestPermit(cancellation);
            String url = searchUrl(criteria, page);
            HttpFetchResult result = httpClient.get(url, HTML_ACCEPT, site().baseUrl() + "/", cancellation);
            ensureUsable(result, url, cancellation);

            Document document = Jsoup.parse(result.body(), result.finalUrlOrRequested());
            SearchPage parsed = parsePage(document, page);
            int kept = 0;
            for (MarketplaceListing listing : parsed.listings()) {
                if (ListingFilter.matches(criteria, listing) && collected.putIfAbsent(listing.key(), listing) == null) {
                    kept++;
                }
            }
            log.debug("{} page {}: {} parsed, {} kept", site().key(), page, parsed.listings().size(), kept);
            if (!parsed.hasNextPage()) {
                break;
            }
        }
        return new ArrayList<>(collected.values());
    }

    protected abstract String searchUrl(SearchCriteria criteria, int page);

    protected abstract SearchPage parsePage(Document document, int page) throws AdapterException;

    private void ensureUsable(HttpFetchResult result, String url, CancellationToken cancellation)
        throws AdapterException {
        AdapterErrorKind kind = FetchFailureClassifier.classify(result);
        if (kind == null && (result.body() == null || result.body().isBlank())) {
            kind = AdapterErrorKind.PARSE;
        }
        if (kind == null) {
            return;
        }
        if (kind == AdapterErrorKind.CANCELLED || cancellation.isCancelled()) {
            throw AdapterException.cancelled(site(), "request aborted: " + url);
        }
        String detail = result.errorCode() != null
            ? result.errorCode() + " " + result.errorMessage()
            : "http_" + result.statusCode();
        throw new AdapterException(kind, site(), detail + " for " + url);
    }

    protected record SearchPage(List<MarketplaceListing> listings, boolean hasNextPage) {
        public SearchPage {
            listings = listings == null ? List.of() : List.copyOf(listings);
        }
    }
}
