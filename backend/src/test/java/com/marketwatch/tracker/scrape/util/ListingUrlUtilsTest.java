package com.marketwatch.tracker.scrape.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ListingUrlUtilsTest {

    @Test
    void absolutizesRelativeAndProtocolRelativeLinks() {
        assertEquals("https://jp.mercari.com/item/m123", ListingUrlUtils.absolutize("https://jp.mercari.com", "/item/m123"));
        assertEquals("https://item.rakuten.co.jp/shop/abc", ListingUrlUtils.absolutize("https://search.rakuten.co.jp", "//item.rakuten.co.jp/shop/abc"));
        assertNull(ListingUrlUtils.absolutize("https://jp.mercari.com", " "));
    }

    @Test
    void extractsIdentifiers() {
        assertEquals("m123", ListingUrlUtils.lastPathSegment("https://jp.mercari.com/item/m123/"));
        assertEquals("10001234", ListingUrlUtils.numericId("https://item.rakuten.co.jp/shop/10001234/?s=1"));
        assertNull(ListingUrlUtils.numericId("https://item.rakuten.co.jp/shop/abc/"));
    }

    @Test
    void normalizeDropsQueryAndTrailingSlash() {
        assertEquals("https://page.auctions.yahoo.co.jp/jp/auction/x1",
            ListingUrlUtils.normalize("HTTPS://Page.Auctions.Yahoo.co.jp/jp/auction/x1/?ref=top#a"));
        assertNull(ListingUrlUtils.normalize("not a url"));
    }
}
