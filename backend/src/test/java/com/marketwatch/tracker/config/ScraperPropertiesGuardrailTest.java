package com.marketwatch.tracker.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
        assertTrue(properties.getAcceptLanguage().startsWith("ja-JP"));
    }

    @Test
    void pinnedUserAgentWinsOverPoolAndBlankPoolEntriesAreDropped() {
        ScraperProperties properties = new ScraperProperties();
        properties.setUserAgents(List.of(" ", "pool-agent/2.0"));
        assertEquals(List.of("pool-agent/2.0"), properties.getUserAgents());
        assertEquals("pool-agent/2.0", properties.nextUserAgent());

        properties.setUserAgent("pinned/1.0");
        assertEquals("pinned/1.0", properties.nextUserAgent());

        properties.setUserAgent(null);
        properties.setUserAgents(List.of());
        assertTrue(properties.nextUserAgent().startsWith("Mozilla/5.0"));
        assertEquals(30, new ScraperProperties().getFeedRetentionDays());
    }

    @Test
    void concurrencyDelaysAndRetriesAreClamped() {
        ScraperProperties properties = new ScraperProperties();
        properties.setGlobalConcurrency(0);
        properties.setSearchConcurrency(-3);
        properties.setPerHostDelayMs(-10);
        properties.setAdapterMaxRetries(50);
        properties.setPageLimit(0);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getSearchConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
        assertEquals(5, properties.getAdapterMaxRetries());
        assertEquals(1, properties.getPageLimit());
    }

    @Test
    void siteLookupAcceptsEnumStyleKeysAndFallsBackToDefaults() {
        ScraperProperties properties = new ScraperProperties();
        ScraperProperties.Site yahoo = new ScraperProperties.Site();
        yahoo.setRequestsPerSecond(2.0);
        properties.getSites().put("yahoo-auctions", yahoo);

        assertSame(yahoo, properties.siteFor("YAHOO_AUCTIONS", false));
        ScraperProperties.Site browser = properties.siteFor("MERCARI", true);
        assertEquals(1, browser.getMaxConcurrent());
        assertEquals(0.2, browser.getRequestsPerSecond());
        assertEquals(0.5, properties.siteFor(null, false).getRequestsPerSecond());
    }

    @Test
    void webhookIsDisabledWithoutUrlAndSampleLimitIsCapped() {
        ScraperProperties.Webhook webhook = new ScraperProperties.Webhook();
        webhook.setEnabled(true);
        assertFalse(webhook.isEnabled());
        webhook.setUrl("https://hooks.example.test/notify");
        assertTrue(webhook.isEnabled());
        webhook.setSampleLimit(40);
        assertEquals(10, webhook.getSampleLimit());
    }

    @Test
    void thinkTimeMaxNeverDropsBelowMin() {
        ScraperProperties.Browser browser = new ScraperProperties.Browser();
        browser.setThinkTimeMinMs(800);
        browser.setThinkTimeMaxMs(100);
        assertEquals(800, browser.getThinkTimeMaxMs());
        browser.setScrollStepPx(5);
        assertEquals(50, browser.getScrollStepPx());
    }
}
