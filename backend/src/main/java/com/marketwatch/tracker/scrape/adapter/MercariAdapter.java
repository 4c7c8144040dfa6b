package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.guard.SiteGuard;
import com.marketwatch.tracker.scrape.guard.SiteGuardRegistry;
import com.marketwatch.tracker.scrape.model.ListingKey;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import com.marketwatch.tracker.scrape.util.FetchFailureClassifier;
import com.marketwatch.tracker.scrape.util.ListingFilter;
import com.marketwatch.tracker.scrape.util.ListingUrlUtils;
import com.marketwatch.tracker.scrape.util.PriceParser;
import jakarta.annotation.PreDestroy;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Mercari renders results client-side, so this adapter drives one long-lived browser session.
 * Only one fetch uses the session at a time.
 */
@Component
public class MercariAdapter implements SiteAdapter {
    private static final Logger log = LoggerFactory.getLogger(MercariAdapter.class);
    private static final String SEARCH_PATH = "/search";

    private final BrowserSessionFactory sessionFactory;
    private final SiteGuardRegistry guards;
    private final ScraperProperties properties;
    private final Clock clock;
    private final Semaphore sessionPermit = new Semaphore(1, true);
    private final Object sessionLock = new Object();
    private WebDriver driver;

    public MercariAdapter(
        BrowserSessionFactory sessionFactory,
        SiteGuardRegistry guards,
        ScraperProperties properties,
        Clock clock
    ) {
        this.sessionFactory = sessionFactory;
        this.guards = guards;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public MarketplaceSite site() {
        return MarketplaceSite.MERCARI;
    }

    @Override
    public List<MarketplaceListing> fetch(SearchCriteria criteria, int pageLimit, CancellationToken cancellation)
        throws AdapterException {
        SiteGuard guard = guards.guard(site());
        acquireSessionPermit(cancellation);
        try (CancellationToken.Registration ignored = cancellation.onCancel(this::releaseSession)) {
            WebDriver session = session();
            guard.awaitRequestPermit(cancellation);
            String url = searchUrl(criteria);
            log.debug("Mercari navigating to {}", url);
            session.get(url);
            think(cancellation);

            Document document = snapshot(session);
            if (document.select("li[data-testid=item-cell]").isEmpty()
                && (FetchFailureClassifier.looksBlocked(document.outerHtml()) || blockedTitle(session.getTitle()))) {
                releaseSession();
                throw AdapterException.blocked(site(), "block page served for " + url);
            }

            scrollResults(session, pageLimit, cancellation);
            return extract(snapshot(session), criteria);
        } catch (AdapterException e) {
            if (e.kind() == AdapterErrorKind.CANCELLED) {
                releaseSession();
            }
            throw e;
        } catch (WebDriverException e) {
            if (cancellation.isCancelled()) {
                throw AdapterException.cancelled(site(), "browser session aborted");
            }
            releaseSession();
            if (e instanceof TimeoutException) {
                throw new AdapterException(AdapterErrorKind.TIMEOUT, site(), "page load timed out", e);
            }
            throw new AdapterException(AdapterErrorKind.NETWORK, site(), "browser session failed: " + e.getMessage(), e);
        } finally {
            sessionPermit.release();
        }
    }

    String searchUrl(SearchCriteria criteria) {
        StringBuilder url = new StringBuilder(site().baseUrl())
            .append(SEARCH_PATH)
            .append("?keyword=").append(URLEncoder.encode(criteria.joinedKeywords(" "), StandardCharsets.UTF_8))
            .append("&status=on_sale&sort=created_time&order=desc");
        if (criteria.minPriceMinor() != null) {
            url.append("&price_min=").append(criteria.minPriceMinor());
        }
        if (criteria.maxPriceMinor() != null) {
            url.append("&price_max=").append(criteria.maxPriceMinor());
        }
        return url.toString();
    }

    List<MarketplaceListing> extract(Document document, SearchCriteria criteria) throws AdapterException {
        if (document.body() == null || document.body().children().isEmpty()) {
            throw AdapterException.parse(site(), "empty document from browser session", null);
        }
        Instant fetchedAt = clock.instant();
        Map<ListingKey, MarketplaceListing> collected = new LinkedHashMap<>();
        for (Element cell : document.select("li[data-testid=item-cell]")) {
            MarketplaceListing listing = parseCell(cell, fetchedAt);
            if (listing != null && ListingFilter.matches(criteria, listing)) {
                collected.putIfAbsent(listing.key(), listing);
            }
        }
        return new ArrayList<>(collected.values());
    }

    private MarketplaceListing parseCell(Element cell, Instant fetchedAt) {
        Element link = cell.selectFirst("a[data-testid=thumbnail-link][href]");
        if (link == null) {
            link = cell.selectFirst("a[href*=/item/]");
        }
        Element priceElement = cell.selectFirst("span[class*=merPrice] span[class*=number__]");
        if (priceElement == null) {
            priceElement = cell.selectFirst("[class*=price]");
        }
        if (link == null || priceElement == null) {
            log.debug("Skipping Mercari cell without link or price");
            return null;
        }
        String url = ListingUrlUtils.absolutize(site().baseUrl(), link.attr("href"));
        String externalId = ListingUrlUtils.lastPathSegment(url);
        Long price = PriceParser.parseYen(priceElement.text());
        String title = titleOf(cell);
        if (url == null || externalId == null || price == null || title == null) {
            log.debug("Skipping unparseable Mercari cell: {}", link.attr("href"));
            return null;
        }
        Element image = cell.selectFirst("picture img[src], img[src]");
        String imageUrl = image == null ? "" : image.absUrl("src");
        return new MarketplaceListing(
            site(),
            externalId,
            title,
            price,
            "JPY",
            url,
            imageUrl.isBlank() ? null : imageUrl,
            fetchedAt
        );
    }

    private String titleOf(Element cell) {
        Element labelled = cell.selectFirst("div[role=img][aria-label]");
        if (labelled != null && !labelled.attr("aria-label").isBlank()) {
            return stripPriceSuffix(labelled.attr("aria-label").trim());
        }
        Element name = cell.selectFirst("[data-testid=thumbnail-item-name]");
        if (name != null && !name.text().isBlank()) {
            return name.text().trim();
        }
        Element image = cell.selectFirst("img[alt]");
        return image == null || image.attr("alt").isBlank() ? null : image.attr("alt").trim();
    }

    private static String stripPriceSuffix(String label) {
        // aria-labels read "<title>の画像 <price>円"
        int idx = label.indexOf("の画像");
        return idx > 0 ? label.substring(0, idx) : label;
    }

    private void scrollResults(WebDriver session, int pageLimit, CancellationToken cancellation)
        throws AdapterException {
        if (!(session instanceof JavascriptExecutor js)) {
            return;
        }
        ScraperProperties.Browser browser = properties.getBrowser();
        int maxSteps = browser.getMaxScrollSteps() * Math.max(1, pageLimit);
        long position = 0;
        long height = scrollHeight(js);
        int steps = 0;
        while (position < height && steps < maxSteps) {
            cancellation.throwIfCancelled(site());
            position += browser.getScrollStepPx();
            js.executeScript("window.scrollTo(0, arguments[0]);", position);
            think(cancellation);
            height = scrollHeight(js);
            steps++;
        }
        log.debug("Mercari scrolled {} steps (height {})", steps, height);
    }

    private long scrollHeight(JavascriptExecutor js) {
        Object value = js.executeScript("return document.body.scrollHeight;");
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private Document snapshot(WebDriver session) {
        String source = session.getPageSource();
        String location = session.getCurrentUrl();
        return Jsoup.parse(source == null ? "" : source, location == null ? site().baseUrl() : location);
    }

    private boolean blockedTitle(String title) {
        if (title == null) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return lower.contains("access denied") || lower.contains("captcha") || lower.contains("just a moment");
    }

    private void think(CancellationToken cancellation) throws AdapterException {
        ScraperProperties.Browser browser = properties.getBrowser();
        int min = browser.getThinkTimeMinMs();
        int max = browser.getThinkTimeMaxMs();
        long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1L) : min;
        cancellation.sleep(Duration.ofMillis(delay), site());
    }

    private void acquireSessionPermit(CancellationToken cancellation) throws AdapterException {
        try {
            while (!sessionPermit.tryAcquire(200, TimeUnit.MILLISECONDS)) {
                cancellation.throwIfCancelled(site());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AdapterException.cancelled(site(), "interrupted waiting for browser session");
        }
        if (cancellation.isCancelled()) {
            sessionPermit.release();
            cancellation.throwIfCancelled(site());
        }
    }

    private WebDriver session() {
        synchronized (sessionLock) {
            if (driver == null) {
                driver = sessionFactory.openSession();
            }
            return driver;
        }
    }

    boolean hasSession() {
        synchronized (sessionLock) {
            return driver != null;
        }
    }

    void releaseSession() {
        WebDriver current;
        synchronized (sessionLock) {
            current = driver;
            driver = null;
        }
        if (current == null) {
            return;
        }
        try {
            current.quit();
            log.info("Mercari browser session closed");
        } catch (WebDriverException e) {
            log.warn("Failed to quit Mercari browser session: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        releaseSession();
    }
}
