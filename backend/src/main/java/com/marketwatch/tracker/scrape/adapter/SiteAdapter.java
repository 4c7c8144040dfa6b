package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SearchCriteria;

import java.util.List;

public interface SiteAdapter {
    MarketplaceSite site();

    List<MarketplaceListing> fetch(SearchCriteria criteria, int pageLimit, CancellationToken cancellation)
        throws AdapterException;
}
