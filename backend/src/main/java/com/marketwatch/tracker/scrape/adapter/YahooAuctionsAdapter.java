package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.scrape.guard.SiteGuardRegistry;
import com.marketwatch.tracker.scrape.http.PoliteHttpClient;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import com.marketwatch.tracker.scrape.util.ListingUrlUtils;
import com.marketwatch.tracker.scrape.util.PriceParser;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class YahooAuctionsAdapter extends StaticPageSiteAdapter {
    private static final Logger log = LoggerFactory.getLogger(YahooAuctionsAdapter.class);
    static final int PAGE_SIZE = 100;

    public YahooAuctionsAdapter(PoliteHttpClient httpClient, SiteGuardRegistry guards, Clock clock) {
        super(httpClient, guards, clock);
    }

    @Override
    public MarketplaceSite site() {
        return MarketplaceSite.YAHOO_AUCTIONS;
    }

    @Override
    protected String searchUrl(SearchCriteria criteria, int page) {
        String keywords = URLEncoder.encode(criteria.joinedKeywords(" "), StandardCharsets.UTF_8);
        int offset = (page - 1) * PAGE_SIZE + 1;
        StringBuilder url = new StringBuilder(site().baseUrl())
            .append("/search/search?p=").append(keywords)
            .append("&va=").append(keywords)
            .append("&b=").append(offset)
            .append("&n=").append(PAGE_SIZE)
            .append("&fixed=3&s1=new");
        if (criteria.minPriceMinor() != null) {
            url.append("&aucminprice=").append(criteria.minPriceMinor());
        }
        if (criteria.maxPriceMinor() != null) {
            url.append("&aucmaxprice=").append(criteria.maxPriceMinor());
        }
        return url.toString();
    }

    @Override
    protected SearchPage parsePage(Document document, int page) throws AdapterException {
        Elements items = document.select("li.Product");
        if (items.isEmpty()) {
            if (page == 1 && document.selectFirst(".Products, .Notice, .Empty, #allContents") == null) {
                throw AdapterException.parse(site(), "no result container on search page", null);
            }
            return new SearchPage(List.of(), false);
        }
        Instant fetchedAt = clock.instant();
        List<MarketplaceListing> listings = new ArrayList<>();
        for (Element item : items) {
            MarketplaceListing listing = parseItem(item, document.location(), fetchedAt);
            if (listing != null) {
                listings.add(listing);
            }
        }
        return new SearchPage(listings, items.size() >= PAGE_SIZE);
    }

    private MarketplaceListing parseItem(Element item, String pageUrl, Instant fetchedAt) {
        Element titleElement = item.selectFirst(".Product__title");
        Element priceElement = item.selectFirst(".Product__price");
        Element link = item.selectFirst(".Product__title a[href], a[href]");
        if (titleElement == null || priceElement == null || link == null) {
            log.debug("Skipping Yahoo item without title, price or link");
            return null;
        }
        Long price = PriceParser.parseYen(priceElement.text());
        String url = ListingUrlUtils.absolutize(pageUrl, link.attr("href"));
        String externalId = ListingUrlUtils.lastPathSegment(url);
        if (price == null || url == null || externalId == null) {
            log.debug("Skipping Yahoo item with unparseable price or url: {}", link.attr("href"));
            return null;
        }
        Element image = item.selectFirst("img[src]");
        return new MarketplaceListing(
            site(),
            externalId,
            titleElement.text().trim(),
            price,
            "JPY",
            url,
            image == null ? null : image.absUrl("src"),
            fetchedAt
        );
    }
}
