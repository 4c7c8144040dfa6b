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
public class RakutenAdapter extends StaticPageSiteAdapter {
    private static final Logger log = LoggerFactory.getLogger(RakutenAdapter.class);
    private static final String[] PRICE_SELECTORS = {
        "div[class*=price--] [class*=price--]",
        ".important",
        "span[class*=price]",
        "div[class*=price]"
    };

    public RakutenAdapter(PoliteHttpClient httpClient, SiteGuardRegistry guards, Clock clock) {
        super(httpClient, guards, clock);
    }

    @Override
    public MarketplaceSite site() {
        return MarketplaceSite.RAKUTEN;
    }

    @Override
    protected String searchUrl(SearchCriteria criteria, int page) {
        String keywords = URLEncoder.encode(criteria.joinedKeywords("　"), StandardCharsets.UTF_8)
            .replace("+", "%20");
        StringBuilder url = new StringBuilder(site().baseUrl())
            .append("/search/mall/").append(keywords)
            .append("/?p=").append(page)
            .append("&s=4");
        if (criteria.minPriceMinor() != null) {
            url.append("&min=").append(criteria.minPriceMinor());
        }
        if (criteria.maxPriceMinor() != null) {
            url.append("&max=").append(criteria.maxPriceMinor());
        }
        return url.toString();
    }

    @Override
    protected SearchPage parsePage(Document document, int page) throws AdapterException {
        Elements items = document.select("div.searchresultitem, div.dui-card");
        if (items.isEmpty()) {
            if (page == 1 && document.selectFirst("div.searchresults, div.dui-container, .noresult") == null) {
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
        return new SearchPage(listings, page < totalPages(document));
    }

    static int totalPages(Document document) {
        Element pagination = document.selectFirst("div.dui-pagination");
        if (pagination == null) {
            return 1;
        }
        int max = 1;
        for (Element element : pagination.select("a, span")) {
            String text = element.text().trim();
            if (text.matches("\\d{1,4}")) {
                max = Math.max(max, Integer.parseInt(text));
            }
        }
        return max;
    }

    private MarketplaceListing parseItem(Element item, String pageUrl, Instant fetchedAt) {
        Element link = item.selectFirst("h2[class*=title-link-wrapper] a[href]");
        if (link == null) {
            link = item.selectFirst("h2 a[href], a[class*=title][href]");
        }
        if (link == null) {
            log.debug("Skipping Rakuten item without title link");
            return null;
        }
        Long price = null;
        for (String selector : PRICE_SELECTORS) {
            Element priceElement = item.selectFirst(selector);
            if (priceElement != null) {
                price = PriceParser.parseYen(priceElement.text());
                if (price != null) {
                    break;
                }
            }
        }
        String url = ListingUrlUtils.absolutize(pageUrl, link.attr("href"));
        if (price == null || url == null) {
            log.debug("Skipping Rakuten item with unparseable price or url: {}", link.attr("href"));
            return null;
        }
        String externalId = item.attr("data-item-id");
        if (externalId == null || externalId.isBlank()) {
            externalId = ListingUrlUtils.numericId(url);
        }
        if (externalId == null || externalId.isBlank()) {
            externalId = ListingUrlUtils.normalize(url);
        }
        if (externalId == null) {
            return null;
        }
        Element image = item.selectFirst("img[src]");
        return new MarketplaceListing(
            site(),
            externalId,
            link.text().trim(),
            price,
            "JPY",
            url,
            image == null ? null : image.absUrl("src"),
            fetchedAt
        );
    }
}
