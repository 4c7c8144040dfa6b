package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class SiteAdapterRegistry {
    private final Map<MarketplaceSite, SiteAdapter> adapters = new EnumMap<>(MarketplaceSite.class);

    public SiteAdapterRegistry(List<SiteAdapter> adapters) {
        for (SiteAdapter adapter : adapters) {
            SiteAdapter previous = this.adapters.put(adapter.site(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter for site " + adapter.site().key());
            }
        }
    }

    public SiteAdapter adapterFor(MarketplaceSite site) {
        return adapters.get(site);
    }
}
