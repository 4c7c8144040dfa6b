package com.marketwatch.tracker.scrape.adapter;

import com.marketwatch.tracker.config.ScraperProperties;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
public class ChromeBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(ChromeBrowserSessionFactory.class);

    private final ScraperProperties properties;

    public ChromeBrowserSessionFactory(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public WebDriver openSession() {
        ScraperProperties.Browser browser = properties.getBrowser();
        log.info("Starting Chrome session (headless={})", browser.isHeadless());

        ChromeOptions options = new ChromeOptions();
        if (browser.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--disable-extensions");
        options.addArguments("--disable-notifications");
        options.addArguments("--blink-settings=imagesEnabled=false");
        options.addArguments("--lang=ja-JP");
        options.addArguments("--user-agent=" + properties.nextUserAgent());
        options.setExperimentalOption("excludeSwitches", List.of("enable-automation"));

        WebDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(browser.getPageLoadTimeoutSeconds()));
        driver.manage().window().setSize(new Dimension(1366, 900));
        return driver;
    }
}
