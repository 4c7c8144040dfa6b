package com.marketwatch.tracker.scrape.adapter;

import org.openqa.selenium.WebDriver;

public interface BrowserSessionFactory {
    WebDriver openSession();
}
